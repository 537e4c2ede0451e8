package com.nevis.codeindex.repository;

import com.nevis.codeindex.model.FileCheckpoint;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

import java.sql.Array;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

@Repository
@RequiredArgsConstructor
public class JdbcFileCheckpointRepository implements FileCheckpointRepository {

    private final JdbcClient jdbcClient;

    private final RowMapper<FileCheckpoint> checkpointRowMapper = (rs, rowNum) -> new FileCheckpoint(
        rs.getObject("id", UUID.class),
        rs.getObject("repository_id", UUID.class),
        rs.getString("file_path"),
        rs.getString("content_hash"),
        rs.getString("revision"),
        toUuids(rs.getArray("chunk_ids")),
        rs.getInt("chunk_count"),
        rs.getObject("created_at", OffsetDateTime.class),
        rs.getObject("updated_at", OffsetDateTime.class)
    );

    @Override
    public List<FileCheckpoint> findByRepositoryId(UUID repositoryId) {
        return jdbcClient.sql("SELECT * FROM file_checkpoints WHERE repository_id = :repositoryId ORDER BY file_path")
            .param("repositoryId", repositoryId)
            .query(checkpointRowMapper)
            .list();
    }

    @Override
    public Optional<FileCheckpoint> findByPath(UUID repositoryId, String filePath) {
        return jdbcClient.sql("SELECT * FROM file_checkpoints WHERE repository_id = :repositoryId AND file_path = :filePath")
            .param("repositoryId", repositoryId)
            .param("filePath", filePath)
            .query(checkpointRowMapper)
            .optional();
    }

    @Override
    public FileCheckpoint upsert(FileCheckpoint checkpoint) {
        return jdbcClient.sql("""
                INSERT INTO file_checkpoints (repository_id, file_path, content_hash, revision, chunk_ids, chunk_count)
                VALUES (:repositoryId, :filePath, :contentHash, :revision, CAST(:chunkIds AS uuid[]), :chunkCount)
                ON CONFLICT (repository_id, file_path) DO UPDATE
                SET content_hash = EXCLUDED.content_hash,
                    revision = EXCLUDED.revision,
                    chunk_ids = EXCLUDED.chunk_ids,
                    chunk_count = EXCLUDED.chunk_count,
                    updated_at = NOW()
                RETURNING *
                """)
            .param("repositoryId", checkpoint.repositoryId())
            .param("filePath", checkpoint.filePath())
            .param("contentHash", checkpoint.contentHash())
            .param("revision", checkpoint.revision())
            .param("chunkIds", toArrayLiteral(checkpoint.chunkIds()))
            .param("chunkCount", checkpoint.chunkIds().size())
            .query(checkpointRowMapper)
            .single();
    }

    @Override
    public void invalidate(UUID repositoryId, String filePath) {
        jdbcClient.sql("""
                UPDATE file_checkpoints
                SET content_hash = '', updated_at = NOW()
                WHERE repository_id = :repositoryId AND file_path = :filePath
                """)
            .param("repositoryId", repositoryId)
            .param("filePath", filePath)
            .update();
    }

    @Override
    public void deleteByPath(UUID repositoryId, String filePath) {
        jdbcClient.sql("DELETE FROM file_checkpoints WHERE repository_id = :repositoryId AND file_path = :filePath")
            .param("repositoryId", repositoryId)
            .param("filePath", filePath)
            .update();
    }

    @Override
    public void deleteByRepositoryId(UUID repositoryId) {
        jdbcClient.sql("DELETE FROM file_checkpoints WHERE repository_id = :repositoryId")
            .param("repositoryId", repositoryId)
            .update();
    }

    private static String toArrayLiteral(List<UUID> ids) {
        return ids.stream().map(UUID::toString).collect(Collectors.joining(",", "{", "}"));
    }

    private static List<UUID> toUuids(Array array) throws SQLException {
        if (array == null) {
            return List.of();
        }
        Object[] values = (Object[]) array.getArray();
        List<UUID> ids = new ArrayList<>(values.length);
        for (Object value : values) {
            ids.add(value instanceof UUID uuid ? uuid : UUID.fromString(value.toString()));
        }
        return ids;
    }
}
