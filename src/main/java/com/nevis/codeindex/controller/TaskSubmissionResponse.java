package com.nevis.codeindex.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.nevis.codeindex.model.TaskStatus;
import com.nevis.codeindex.model.TaskType;

import java.util.UUID;

public record TaskSubmissionResponse(
    @JsonProperty("task_id")
    UUID taskId,

    @JsonProperty("repository_id")
    UUID repositoryId,

    TaskType type,

    TaskStatus status
) {}
