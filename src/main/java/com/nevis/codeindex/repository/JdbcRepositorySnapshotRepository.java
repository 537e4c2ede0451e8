package com.nevis.codeindex.repository;

import com.nevis.codeindex.exception.EntityNotFoundException;
import com.nevis.codeindex.model.RepositorySnapshot;
import com.nevis.codeindex.model.RepositoryStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
@RequiredArgsConstructor
public class JdbcRepositorySnapshotRepository implements RepositorySnapshotRepository {

    private final JdbcClient jdbcClient;

    private final RowMapper<RepositorySnapshot> repositoryRowMapper = (rs, rowNum) -> new RepositorySnapshot(
        rs.getObject("id", UUID.class),
        rs.getString("url"),
        rs.getString("name"),
        rs.getString("default_branch"),
        rs.getString("local_path"),
        RepositoryStatus.valueOf(rs.getString("status")),
        rs.getObject("last_synced_at", OffsetDateTime.class),
        rs.getObject("created_at", OffsetDateTime.class),
        rs.getObject("updated_at", OffsetDateTime.class)
    );

    @Override
    public RepositorySnapshot save(RepositorySnapshot repository) {
        return jdbcClient.sql("""
                INSERT INTO repositories (url, name, default_branch, local_path, status)
                VALUES (:url, :name, :defaultBranch, :localPath, :status::repository_status)
                RETURNING *
                """)
            .param("url", repository.url())
            .param("name", repository.name())
            .param("defaultBranch", repository.defaultBranch())
            .param("localPath", repository.localPath())
            .param("status", repository.status() != null ? repository.status().name() : RepositoryStatus.PENDING.name())
            .query(repositoryRowMapper)
            .single();
    }

    @Override
    public Optional<RepositorySnapshot> findById(UUID id) {
        return jdbcClient.sql("SELECT * FROM repositories WHERE id = :id")
            .param("id", id)
            .query(repositoryRowMapper)
            .optional();
    }

    @Override
    public Optional<RepositorySnapshot> findByUrl(String url) {
        return jdbcClient.sql("SELECT * FROM repositories WHERE url = :url")
            .param("url", url)
            .query(repositoryRowMapper)
            .optional();
    }

    @Override
    public List<RepositorySnapshot> findAll() {
        return jdbcClient.sql("SELECT * FROM repositories ORDER BY created_at DESC")
            .query(repositoryRowMapper)
            .list();
    }

    @Override
    public void updateStatus(UUID id, RepositoryStatus status) {
        int rowsAffected = jdbcClient.sql("""
                UPDATE repositories
                SET status = :status::repository_status, updated_at = NOW()
                WHERE id = :id
                """)
            .param("status", status.name())
            .param("id", id)
            .update();

        if (rowsAffected == 0) {
            throw new EntityNotFoundException(id);
        }
    }

    @Override
    public void updateLocalPath(UUID id, String localPath) {
        int rowsAffected = jdbcClient.sql("""
                UPDATE repositories
                SET local_path = :localPath, updated_at = NOW()
                WHERE id = :id
                """)
            .param("localPath", localPath)
            .param("id", id)
            .update();

        if (rowsAffected == 0) {
            throw new EntityNotFoundException(id);
        }
    }

    @Override
    public void markSynced(UUID id) {
        int rowsAffected = jdbcClient.sql("""
                UPDATE repositories
                SET status = 'READY'::repository_status,
                    last_synced_at = NOW(),
                    updated_at = NOW()
                WHERE id = :id
                """)
            .param("id", id)
            .update();

        if (rowsAffected == 0) {
            throw new EntityNotFoundException(id);
        }
    }

    @Override
    public void delete(UUID id) {
        int rowsAffected = jdbcClient.sql("DELETE FROM repositories WHERE id = :id")
            .param("id", id)
            .update();

        if (rowsAffected == 0) {
            throw new EntityNotFoundException(id);
        }
    }
}
