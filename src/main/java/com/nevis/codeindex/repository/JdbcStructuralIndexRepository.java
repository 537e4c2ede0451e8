package com.nevis.codeindex.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nevis.codeindex.model.StructuralIndex;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
@RequiredArgsConstructor
public class JdbcStructuralIndexRepository implements StructuralIndexRepository {

    private final JdbcClient jdbcClient;
    private final ObjectMapper objectMapper;

    @Override
    public Optional<StructuralIndex> findByRepositoryId(UUID repositoryId) {
        return jdbcClient.sql("SELECT index_json::text FROM repository_structure_index WHERE repository_id = :repositoryId")
            .param("repositoryId", repositoryId)
            .query(String.class)
            .optional()
            .map(this::read);
    }

    @Override
    public void save(UUID repositoryId, StructuralIndex index) {
        jdbcClient.sql("""
                INSERT INTO repository_structure_index (repository_id, index_json)
                VALUES (:repositoryId, CAST(:json AS jsonb))
                ON CONFLICT (repository_id) DO UPDATE
                SET index_json = EXCLUDED.index_json, updated_at = NOW()
                """)
            .param("repositoryId", repositoryId)
            .param("json", write(index))
            .update();
    }

    @Override
    public void deleteByRepositoryId(UUID repositoryId) {
        jdbcClient.sql("DELETE FROM repository_structure_index WHERE repository_id = :repositoryId")
            .param("repositoryId", repositoryId)
            .update();
    }

    private StructuralIndex read(String json) {
        try {
            return objectMapper.readValue(json, StructuralIndex.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt structural index", e);
        }
    }

    private String write(StructuralIndex index) {
        try {
            return objectMapper.writeValueAsString(index);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize structural index", e);
        }
    }
}
