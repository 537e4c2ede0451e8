package com.nevis.codeindex.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.nevis.codeindex.model.RepositoryStatus;

import java.time.OffsetDateTime;
import java.util.UUID;

public record RepositoryResponse(
    UUID id,

    String url,

    String name,

    @JsonProperty("default_branch")
    String defaultBranch,

    RepositoryStatus status,

    @JsonProperty("active_task_id")
    UUID activeTaskId,

    @JsonProperty("last_synced_at")
    OffsetDateTime lastSyncedAt,

    @JsonProperty("created_at")
    OffsetDateTime createdAt
) {}
