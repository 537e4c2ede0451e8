package com.nevis.codeindex.model;

import java.time.OffsetDateTime;
import java.util.UUID;

public record IndexingTask(
    UUID id,
    UUID repositoryId,
    TaskType type,
    TaskStatus status,
    double progressPct,
    String currentStage,
    int filesTotal,
    int filesProcessed,
    String failedAtStage,
    String errorMessage,
    OffsetDateTime createdAt,
    OffsetDateTime updatedAt
) {}
