package com.nevis.codeindex.model;

import java.time.OffsetDateTime;
import java.util.UUID;

public record RepositorySnapshot(
    UUID id,
    String url,
    String name,
    String defaultBranch,
    String localPath,
    RepositoryStatus status,
    OffsetDateTime lastSyncedAt,
    OffsetDateTime createdAt,
    OffsetDateTime updatedAt
) {
    public boolean isLocal() {
        return !url.startsWith("http://") && !url.startsWith("https://");
    }
}
