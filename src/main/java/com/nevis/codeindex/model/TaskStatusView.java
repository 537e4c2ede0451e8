package com.nevis.codeindex.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.UUID;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskStatusView(
    @JsonProperty("task_id") UUID taskId,
    @JsonProperty("repository_id") UUID repositoryId,
    TaskType type,
    TaskStatus status,
    @JsonProperty("progress_pct") double progressPct,
    @JsonProperty("current_stage") String currentStage,
    @JsonProperty("files_total") int filesTotal,
    @JsonProperty("files_processed") int filesProcessed,
    @JsonProperty("failed_at_stage") String failedAtStage,
    @JsonProperty("error_message") String errorMessage
) {
    public static TaskStatusView from(IndexingTask task) {
        return new TaskStatusView(
            task.id(),
            task.repositoryId(),
            task.type(),
            task.status(),
            task.progressPct(),
            task.currentStage(),
            task.filesTotal(),
            task.filesProcessed(),
            task.failedAtStage(),
            task.errorMessage()
        );
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }
}
