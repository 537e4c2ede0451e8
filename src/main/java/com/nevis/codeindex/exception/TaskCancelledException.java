package com.nevis.codeindex.exception;

import lombok.Getter;

import java.util.UUID;

@Getter
public class TaskCancelledException extends RuntimeException {
    private final UUID taskId;

    public TaskCancelledException(UUID taskId) {
        super("Task cancelled: " + taskId);
        this.taskId = taskId;
    }
}
