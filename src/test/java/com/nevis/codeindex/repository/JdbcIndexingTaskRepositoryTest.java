package com.nevis.codeindex.repository;

import com.nevis.codeindex.model.IndexingTask;
import com.nevis.codeindex.model.RepositorySnapshot;
import com.nevis.codeindex.model.RepositoryStatus;
import com.nevis.codeindex.model.TaskStatus;
import com.nevis.codeindex.model.TaskType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.simple.JdbcClient;

import java.time.Duration;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JdbcIndexingTaskRepositoryTest extends BaseIntegrationTest {

    @Autowired
    private IndexingTaskRepository taskRepository;

    @Autowired
    private RepositorySnapshotRepository repositoryRepository;

    @Autowired
    private JdbcClient jdbcClient;

    private UUID repositoryId;

    @BeforeEach
    void setUp() {
        repositoryId = repositoryRepository.save(new RepositorySnapshot(
            null, "https://github.com/acme/" + UUID.randomUUID(), "acme/app", "main", null,
            RepositoryStatus.PENDING, null, null, null)).id();
    }

    @Nested
    @DisplayName("Single active task")
    class SingleActiveTask {

        @Test
        @DisplayName("Second active task for the same repository violates the unique index")
        void shouldRejectSecondActiveTask() {
            taskRepository.create(repositoryId, TaskType.FULL_REINDEX);

            assertThatThrownBy(() -> taskRepository.create(repositoryId, TaskType.INCREMENTAL_SYNC))
                .isInstanceOf(DuplicateKeyException.class);
        }

        @Test
        @DisplayName("New task is accepted once the previous one is terminal")
        void shouldAllowTaskAfterTerminal() {
            IndexingTask first = taskRepository.create(repositoryId, TaskType.FULL_REINDEX);
            assertThat(taskRepository.markCompleted(first.id())).isTrue();

            IndexingTask second = taskRepository.create(repositoryId, TaskType.INCREMENTAL_SYNC);

            assertThat(taskRepository.findActiveByRepositoryId(repositoryId)).map(IndexingTask::id).contains(second.id());
            assertThat(taskRepository.findByRepositoryId(repositoryId)).hasSize(2);
        }
    }

    @Nested
    @DisplayName("Status transitions")
    class Transitions {

        @Test
        @DisplayName("Should persist progress, counters and completion")
        void shouldTrackProgress() {
            IndexingTask task = taskRepository.create(repositoryId, TaskType.FULL_REINDEX);
            assertThat(task.status()).isEqualTo(TaskStatus.PENDING);
            assertThat(task.currentStage()).isEqualTo("Queued");

            taskRepository.updateProgress(task.id(), TaskStatus.EMBEDDING, 42.5, "Embedding chunks");
            taskRepository.updateFileCounters(task.id(), 10, 4);

            IndexingTask running = taskRepository.findById(task.id()).orElseThrow();
            assertThat(running.status()).isEqualTo(TaskStatus.EMBEDDING);
            assertThat(running.progressPct()).isEqualTo(42.5);
            assertThat(running.filesTotal()).isEqualTo(10);
            assertThat(running.filesProcessed()).isEqualTo(4);

            assertThat(taskRepository.markCompleted(task.id())).isTrue();
            IndexingTask done = taskRepository.findById(task.id()).orElseThrow();
            assertThat(done.status()).isEqualTo(TaskStatus.COMPLETED);
            assertThat(done.progressPct()).isEqualTo(100.0);
        }

        @Test
        @DisplayName("Terminal tasks are never updated again")
        void shouldIgnoreUpdatesOfTerminalTasks() {
            IndexingTask task = taskRepository.create(repositoryId, TaskType.FULL_REINDEX);
            assertThat(taskRepository.markCancelled(task.id())).isTrue();

            assertThat(taskRepository.updateProgress(task.id(), TaskStatus.PARSING, 10, "Parsing")).isFalse();
            assertThat(taskRepository.markFailed(task.id(), "parsing", "boom")).isFalse();
            assertThat(taskRepository.markCompleted(task.id())).isFalse();
            assertThat(taskRepository.findStatus(task.id())).contains(TaskStatus.CANCELLED);
        }

        @Test
        @DisplayName("Failure records the stage and message; retry clears them")
        void shouldRecordFailureDetails() {
            IndexingTask task = taskRepository.create(repositoryId, TaskType.FULL_REINDEX);
            taskRepository.updateProgress(task.id(), TaskStatus.EMBEDDING, 50, "Embedding chunks");
            assertThat(taskRepository.resetForRetry(task.id())).isTrue();
            IndexingTask retried = taskRepository.findById(task.id()).orElseThrow();
            assertThat(retried.status()).isEqualTo(TaskStatus.PENDING);
            assertThat(retried.currentStage()).isEqualTo("Retrying");

            taskRepository.markFailed(task.id(), "embedding", "provider unavailable");

            IndexingTask failed = taskRepository.findById(task.id()).orElseThrow();
            assertThat(failed.status()).isEqualTo(TaskStatus.FAILED);
            assertThat(failed.failedAtStage()).isEqualTo("embedding");
            assertThat(failed.errorMessage()).isEqualTo("provider unavailable");
        }
    }

    @Nested
    @DisplayName("Interruption")
    class Interruption {

        @Test
        @DisplayName("Tasks without recent progress are interrupted")
        void shouldInterruptStaleTasks() {
            IndexingTask task = taskRepository.create(repositoryId, TaskType.FULL_REINDEX);
            jdbcClient.sql("UPDATE indexing_tasks SET updated_at = NOW() - INTERVAL '2 hours' WHERE id = :id")
                .param("id", task.id())
                .update();

            assertThat(taskRepository.interruptStale(Duration.ofMinutes(30))).contains(task.id());

            IndexingTask interrupted = taskRepository.findById(task.id()).orElseThrow();
            assertThat(interrupted.status()).isEqualTo(TaskStatus.INTERRUPTED);
            assertThat(interrupted.errorMessage()).isEqualTo("Task stopped making progress");
        }

        @Test
        @DisplayName("Recently updated tasks are left alone")
        void shouldKeepFreshTasks() {
            IndexingTask task = taskRepository.create(repositoryId, TaskType.FULL_REINDEX);

            assertThat(taskRepository.interruptStale(Duration.ofMinutes(30))).doesNotContain(task.id());
            assertThat(taskRepository.findStatus(task.id())).contains(TaskStatus.PENDING);
        }
    }

    @Test
    @DisplayName("Deleting a repository removes its tasks")
    void shouldCascadeOnRepositoryDelete() {
        IndexingTask task = taskRepository.create(repositoryId, TaskType.FULL_REINDEX);
        taskRepository.markCompleted(task.id());

        repositoryRepository.delete(repositoryId);

        assertThat(taskRepository.findById(task.id())).isEmpty();
    }
}
