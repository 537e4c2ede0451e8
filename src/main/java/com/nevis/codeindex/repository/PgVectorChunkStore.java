package com.nevis.codeindex.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nevis.codeindex.model.ChunkKind;
import com.nevis.codeindex.model.ChunkNode;
import com.nevis.codeindex.model.ChunkSummary;
import com.nevis.codeindex.model.DataModelField;
import com.nevis.codeindex.model.EmbeddedChunk;
import com.pgvector.PGvector;
import lombok.RequiredArgsConstructor;
import lombok.SneakyThrows;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.BatchPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.Types;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

@Slf4j
@Repository
@RequiredArgsConstructor
public class PgVectorChunkStore implements ChunkVectorStore {

    private final JdbcClient jdbcClient;
    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    record ChunkMetadata(
        List<String> calls,
        List<String> decorators,
        String docstring,
        List<DataModelField> dataModelFields
    ) {}

    private final RowMapper<ChunkNode> chunkRowMapper = (rs, rowNum) -> {
        ChunkMetadata metadata = readMetadata(rs.getString("metadata"));
        int part = rs.getInt("part_index");
        Integer partIndex = rs.wasNull() ? null : part;
        return new ChunkNode(
            rs.getObject("chunk_id", UUID.class),
            rs.getObject("repository_id", UUID.class),
            rs.getString("file_path"),
            rs.getString("file_hash"),
            ChunkKind.valueOf(rs.getString("kind")),
            rs.getString("node_type"),
            rs.getString("symbol_name"),
            rs.getString("parent_name"),
            rs.getString("language"),
            rs.getInt("start_line"),
            rs.getInt("end_line"),
            rs.getString("content"),
            metadata.calls(),
            metadata.decorators(),
            metadata.docstring(),
            rs.getBoolean("data_model"),
            metadata.dataModelFields(),
            partIndex
        );
    };

    @Override
    public void upsert(List<EmbeddedChunk> chunks) {
        if (chunks == null || chunks.isEmpty()) {
            return;
        }

        String sql = """
            INSERT INTO code_chunk_vectors
            (chunk_id, repository_id, file_path, file_hash, kind, node_type, symbol_name, parent_name,
             language, start_line, end_line, part_index, data_model, content, metadata, embedding)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, CAST(? AS jsonb), ?)
            ON CONFLICT (chunk_id) DO UPDATE
            SET content = EXCLUDED.content,
                metadata = EXCLUDED.metadata,
                embedding = EXCLUDED.embedding
            """;

        jdbcTemplate.batchUpdate(sql, new BatchPreparedStatementSetter() {
            @Override
            @SneakyThrows
            public void setValues(PreparedStatement ps, int i) {
                EmbeddedChunk embedded = chunks.get(i);
                ChunkNode chunk = embedded.chunk();
                ps.setObject(1, chunk.id());
                ps.setObject(2, chunk.repositoryId());
                ps.setString(3, chunk.filePath());
                ps.setString(4, chunk.fileHash());
                ps.setString(5, chunk.kind().name());
                ps.setString(6, chunk.nodeType());
                ps.setString(7, chunk.symbolName());
                ps.setString(8, chunk.parentName());
                ps.setString(9, chunk.language());
                ps.setInt(10, chunk.startLine());
                ps.setInt(11, chunk.endLine());
                if (chunk.partIndex() == null) {
                    ps.setNull(12, Types.INTEGER);
                } else {
                    ps.setInt(12, chunk.partIndex());
                }
                ps.setBoolean(13, chunk.dataModel());
                ps.setString(14, chunk.content());
                ps.setString(15, writeMetadata(chunk));
                ps.setObject(16, new PGvector(embedded.vector()));
            }

            @Override
            public int getBatchSize() {
                return chunks.size();
            }
        });
    }

    @Override
    public void deleteByIds(UUID repositoryId, Collection<UUID> chunkIds) {
        if (chunkIds.isEmpty()) {
            return;
        }
        int deleted = jdbcClient.sql("DELETE FROM code_chunk_vectors WHERE repository_id = :repositoryId AND chunk_id IN (:ids)")
            .param("repositoryId", repositoryId)
            .param("ids", List.copyOf(chunkIds))
            .update();
        log.debug("Deleted {} vectors of repository {}", deleted, repositoryId);
    }

    @Override
    public void deleteByFile(UUID repositoryId, String filePath) {
        jdbcClient.sql("DELETE FROM code_chunk_vectors WHERE repository_id = :repositoryId AND file_path = :filePath")
            .param("repositoryId", repositoryId)
            .param("filePath", filePath)
            .update();
    }

    @Override
    public void deleteSuperseded(UUID repositoryId, String filePath, Collection<UUID> liveIds) {
        if (liveIds.isEmpty()) {
            deleteByFile(repositoryId, filePath);
            return;
        }
        int deleted = jdbcClient.sql("""
                DELETE FROM code_chunk_vectors
                WHERE repository_id = :repositoryId AND file_path = :filePath AND chunk_id NOT IN (:ids)
                """)
            .param("repositoryId", repositoryId)
            .param("filePath", filePath)
            .param("ids", List.copyOf(liveIds))
            .update();
        if (deleted > 0) {
            log.debug("Purged {} superseded vectors of {}", deleted, filePath);
        }
    }

    @Override
    public void deleteByRepository(UUID repositoryId) {
        jdbcClient.sql("DELETE FROM code_chunk_vectors WHERE repository_id = :repositoryId")
            .param("repositoryId", repositoryId)
            .update();
    }

    @Override
    public Set<UUID> existingIds(UUID repositoryId, Collection<UUID> chunkIds) {
        if (chunkIds.isEmpty()) {
            return Set.of();
        }
        return new HashSet<>(jdbcClient.sql("""
                SELECT chunk_id FROM code_chunk_vectors
                WHERE repository_id = :repositoryId AND chunk_id IN (:ids)
                """)
            .param("repositoryId", repositoryId)
            .param("ids", List.copyOf(chunkIds))
            .query(UUID.class)
            .list());
    }

    @Override
    public Set<UUID> allIds(UUID repositoryId) {
        return new HashSet<>(jdbcClient.sql("SELECT chunk_id FROM code_chunk_vectors WHERE repository_id = :repositoryId")
            .param("repositoryId", repositoryId)
            .query(UUID.class)
            .list());
    }

    @Override
    public List<ChunkNode> findChunks(UUID repositoryId) {
        return jdbcClient.sql("""
                SELECT * FROM code_chunk_vectors
                WHERE repository_id = :repositoryId
                ORDER BY file_path, start_line, part_index NULLS FIRST
                """)
            .param("repositoryId", repositoryId)
            .query(chunkRowMapper)
            .list();
    }

    @Override
    public List<ChunkNode> findByIds(UUID repositoryId, Collection<UUID> chunkIds) {
        if (chunkIds.isEmpty()) {
            return List.of();
        }
        return jdbcClient.sql("""
                SELECT * FROM code_chunk_vectors
                WHERE repository_id = :repositoryId AND chunk_id IN (:ids)
                ORDER BY file_path, start_line, part_index NULLS FIRST
                """)
            .param("repositoryId", repositoryId)
            .param("ids", List.copyOf(chunkIds))
            .query(chunkRowMapper)
            .list();
    }

    @Override
    public List<ChunkSummary> search(UUID repositoryId, float[] vector, int topK) {
        // cosine distance lies in [0, 2]; the score is clamped to [0, 1]
        return jdbcClient.sql("""
                SELECT chunk_id, file_path, start_line, end_line, symbol_name, kind,
                       GREATEST(0, 1 - (embedding <=> :vector)) AS score
                FROM code_chunk_vectors
                WHERE repository_id = :repositoryId
                ORDER BY embedding <=> :vector ASC
                LIMIT :limit
                """)
            .param("vector", new PGvector(vector))
            .param("repositoryId", repositoryId)
            .param("limit", topK)
            .query((rs, rowNum) -> new ChunkSummary(
                rs.getObject("chunk_id", UUID.class),
                rs.getString("file_path"),
                rs.getInt("start_line"),
                rs.getInt("end_line"),
                rs.getString("symbol_name"),
                ChunkKind.valueOf(rs.getString("kind")),
                Math.min(1.0, rs.getDouble("score"))
            ))
            .list();
    }

    private String writeMetadata(ChunkNode chunk) throws JsonProcessingException {
        return objectMapper.writeValueAsString(
            new ChunkMetadata(chunk.calls(), chunk.decorators(), chunk.docstring(), chunk.dataModelFields()));
    }

    private ChunkMetadata readMetadata(String json) {
        if (json == null || json.isBlank()) {
            return new ChunkMetadata(List.of(), List.of(), null, List.of());
        }
        try {
            return objectMapper.readValue(json, ChunkMetadata.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt chunk metadata", e);
        }
    }
}
