package com.nevis.codeindex.exception;

import lombok.Getter;

import java.util.UUID;

@Getter
public class TaskConflictException extends RuntimeException {
    private final UUID repositoryId;
    private final UUID existingTaskId;

    public TaskConflictException(UUID repositoryId, UUID existingTaskId) {
        super(existingTaskId != null
            ? "Repository " + repositoryId + " already has an active task: " + existingTaskId
            : "Repository " + repositoryId + " already has an active task");
        this.repositoryId = repositoryId;
        this.existingTaskId = existingTaskId;
    }
}
