package com.nevis.codeindex.model;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public record FileCheckpoint(
    UUID id,
    UUID repositoryId,
    String filePath,
    String contentHash,
    String revision,
    List<UUID> chunkIds,
    int chunkCount,
    OffsetDateTime createdAt,
    OffsetDateTime updatedAt
) {
    public FileCheckpoint {
        chunkIds = chunkIds == null ? List.of() : List.copyOf(chunkIds);
    }

    public static FileCheckpoint of(UUID repositoryId, String filePath, String contentHash, String revision, List<UUID> chunkIds) {
        return new FileCheckpoint(null, repositoryId, filePath, contentHash, revision, chunkIds, chunkIds.size(), null, null);
    }
}
