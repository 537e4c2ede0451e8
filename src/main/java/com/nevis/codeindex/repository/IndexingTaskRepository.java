package com.nevis.codeindex.repository;

import com.nevis.codeindex.model.IndexingTask;
import com.nevis.codeindex.model.TaskStatus;
import com.nevis.codeindex.model.TaskType;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface IndexingTaskRepository {
    IndexingTask create(UUID repositoryId, TaskType type);
    Optional<IndexingTask> findById(UUID id);
    Optional<IndexingTask> findActiveByRepositoryId(UUID repositoryId);
    List<IndexingTask> findByRepositoryId(UUID repositoryId);
    Optional<TaskStatus> findStatus(UUID id);
    boolean updateProgress(UUID id, TaskStatus status, double progressPct, String currentStage);
    boolean updateFileCounters(UUID id, int filesTotal, int filesProcessed);
    boolean markCompleted(UUID id);
    boolean markFailed(UUID id, String failedAtStage, String errorMessage);
    boolean markCancelled(UUID id);
    boolean resetForRetry(UUID id);
    List<UUID> interruptActive();
    List<UUID> interruptStale(Duration staleAfter);
}
