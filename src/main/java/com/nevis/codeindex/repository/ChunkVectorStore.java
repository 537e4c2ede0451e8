package com.nevis.codeindex.repository;

import com.nevis.codeindex.model.ChunkNode;
import com.nevis.codeindex.model.ChunkSummary;
import com.nevis.codeindex.model.EmbeddedChunk;

import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Vector store holding one entry per chunk id. Writes are idempotent upserts; there is no
 * transaction spanning the store and the relational checkpoint tables.
 */
public interface ChunkVectorStore {

    void upsert(List<EmbeddedChunk> chunks);

    void deleteByIds(UUID repositoryId, Collection<UUID> chunkIds);

    void deleteByFile(UUID repositoryId, String filePath);

    void deleteSuperseded(UUID repositoryId, String filePath, Collection<UUID> liveIds);

    void deleteByRepository(UUID repositoryId);

    Set<UUID> existingIds(UUID repositoryId, Collection<UUID> chunkIds);

    Set<UUID> allIds(UUID repositoryId);

    List<ChunkNode> findChunks(UUID repositoryId);

    List<ChunkNode> findByIds(UUID repositoryId, Collection<UUID> chunkIds);

    List<ChunkSummary> search(UUID repositoryId, float[] vector, int topK);
}
