package com.nevis.codeindex.repository;

import com.nevis.codeindex.model.IndexingTask;
import com.nevis.codeindex.model.TaskStatus;
import com.nevis.codeindex.model.TaskType;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
@RequiredArgsConstructor
public class JdbcIndexingTaskRepository implements IndexingTaskRepository {

    private static final String NOT_TERMINAL =
        "status NOT IN ('COMPLETED'::task_status, 'FAILED'::task_status, 'CANCELLED'::task_status, 'INTERRUPTED'::task_status)";

    private final JdbcClient jdbcClient;

    private final RowMapper<IndexingTask> taskRowMapper = (rs, rowNum) -> new IndexingTask(
        rs.getObject("id", UUID.class),
        rs.getObject("repository_id", UUID.class),
        TaskType.valueOf(rs.getString("type")),
        TaskStatus.valueOf(rs.getString("status")),
        rs.getDouble("progress_pct"),
        rs.getString("current_stage"),
        rs.getInt("files_total"),
        rs.getInt("files_processed"),
        rs.getString("failed_at_stage"),
        rs.getString("error_message"),
        rs.getObject("created_at", OffsetDateTime.class),
        rs.getObject("updated_at", OffsetDateTime.class)
    );

    @Override
    public IndexingTask create(UUID repositoryId, TaskType type) {
        return jdbcClient.sql("""
                INSERT INTO indexing_tasks (repository_id, type, status, progress_pct, current_stage)
                VALUES (:repositoryId, :type::task_type, 'PENDING'::task_status, 0, 'Queued')
                RETURNING *
                """)
            .param("repositoryId", repositoryId)
            .param("type", type.name())
            .query(taskRowMapper)
            .single();
    }

    @Override
    public Optional<IndexingTask> findById(UUID id) {
        return jdbcClient.sql("SELECT * FROM indexing_tasks WHERE id = :id")
            .param("id", id)
            .query(taskRowMapper)
            .optional();
    }

    @Override
    public Optional<IndexingTask> findActiveByRepositoryId(UUID repositoryId) {
        return jdbcClient.sql("""
                SELECT * FROM indexing_tasks
                WHERE repository_id = :repositoryId AND %s
                ORDER BY created_at DESC
                LIMIT 1
                """.formatted(NOT_TERMINAL))
            .param("repositoryId", repositoryId)
            .query(taskRowMapper)
            .optional();
    }

    @Override
    public List<IndexingTask> findByRepositoryId(UUID repositoryId) {
        return jdbcClient.sql("""
                SELECT * FROM indexing_tasks
                WHERE repository_id = :repositoryId
                ORDER BY created_at DESC
                """)
            .param("repositoryId", repositoryId)
            .query(taskRowMapper)
            .list();
    }

    @Override
    public Optional<TaskStatus> findStatus(UUID id) {
        return jdbcClient.sql("SELECT status FROM indexing_tasks WHERE id = :id")
            .param("id", id)
            .query(String.class)
            .optional()
            .map(TaskStatus::valueOf);
    }

    @Override
    public boolean updateProgress(UUID id, TaskStatus status, double progressPct, String currentStage) {
        return jdbcClient.sql("""
                UPDATE indexing_tasks
                SET status = :status::task_status,
                    progress_pct = :progress,
                    current_stage = :stage,
                    updated_at = NOW()
                WHERE id = :id AND %s
                """.formatted(NOT_TERMINAL))
            .param("status", status.name())
            .param("progress", progressPct)
            .param("stage", currentStage)
            .param("id", id)
            .update() > 0;
    }

    @Override
    public boolean updateFileCounters(UUID id, int filesTotal, int filesProcessed) {
        return jdbcClient.sql("""
                UPDATE indexing_tasks
                SET files_total = :total, files_processed = :processed, updated_at = NOW()
                WHERE id = :id AND %s
                """.formatted(NOT_TERMINAL))
            .param("total", filesTotal)
            .param("processed", filesProcessed)
            .param("id", id)
            .update() > 0;
    }

    @Override
    public boolean markCompleted(UUID id) {
        return jdbcClient.sql("""
                UPDATE indexing_tasks
                SET status = 'COMPLETED'::task_status,
                    progress_pct = 100,
                    current_stage = 'Completed',
                    updated_at = NOW()
                WHERE id = :id AND %s
                """.formatted(NOT_TERMINAL))
            .param("id", id)
            .update() > 0;
    }

    @Override
    public boolean markFailed(UUID id, String failedAtStage, String errorMessage) {
        return jdbcClient.sql("""
                UPDATE indexing_tasks
                SET status = 'FAILED'::task_status,
                    failed_at_stage = :stage,
                    error_message = :error,
                    current_stage = 'Failed',
                    updated_at = NOW()
                WHERE id = :id AND %s
                """.formatted(NOT_TERMINAL))
            .param("stage", failedAtStage)
            .param("error", errorMessage)
            .param("id", id)
            .update() > 0;
    }

    @Override
    public boolean markCancelled(UUID id) {
        return jdbcClient.sql("""
                UPDATE indexing_tasks
                SET status = 'CANCELLED'::task_status, current_stage = 'Cancelled', updated_at = NOW()
                WHERE id = :id AND %s
                """.formatted(NOT_TERMINAL))
            .param("id", id)
            .update() > 0;
    }

    @Override
    public boolean resetForRetry(UUID id) {
        return jdbcClient.sql("""
                UPDATE indexing_tasks
                SET status = 'PENDING'::task_status,
                    progress_pct = 0,
                    current_stage = 'Retrying',
                    failed_at_stage = NULL,
                    error_message = NULL,
                    updated_at = NOW()
                WHERE id = :id AND %s
                """.formatted(NOT_TERMINAL))
            .param("id", id)
            .update() > 0;
    }

    @Override
    public List<UUID> interruptActive() {
        return jdbcClient.sql("""
                UPDATE indexing_tasks
                SET status = 'INTERRUPTED'::task_status,
                    current_stage = 'Interrupted',
                    error_message = 'Worker stopped before the task finished',
                    updated_at = NOW()
                WHERE %s
                RETURNING id
                """.formatted(NOT_TERMINAL))
            .query(UUID.class)
            .list();
    }

    @Override
    public List<UUID> interruptStale(Duration staleAfter) {
        return jdbcClient.sql("""
                UPDATE indexing_tasks
                SET status = 'INTERRUPTED'::task_status,
                    current_stage = 'Interrupted',
                    error_message = 'Task stopped making progress',
                    updated_at = NOW()
                WHERE %s
                  AND updated_at < NOW() - (INTERVAL '1 second' * :staleSeconds)
                RETURNING id
                """.formatted(NOT_TERMINAL))
            .param("staleSeconds", staleAfter.toSeconds())
            .query(UUID.class)
            .list();
    }
}
