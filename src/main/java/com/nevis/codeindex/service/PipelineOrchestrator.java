package com.nevis.codeindex.service;

import com.nevis.codeindex.config.IndexingProperties;
import com.nevis.codeindex.event.TaskProgressEvent;
import com.nevis.codeindex.exception.EntityNotFoundException;
import com.nevis.codeindex.exception.NothingToIndexException;
import com.nevis.codeindex.exception.SourceParseException;
import com.nevis.codeindex.exception.TaskCancelledException;
import com.nevis.codeindex.infra.SecretScrubber;
import com.nevis.codeindex.infra.TransientErrors;
import com.nevis.codeindex.model.ChangeSet;
import com.nevis.codeindex.model.ChunkNode;
import com.nevis.codeindex.model.FileCheckpoint;
import com.nevis.codeindex.model.IndexingTask;
import com.nevis.codeindex.model.ParsedFile;
import com.nevis.codeindex.model.PipelineStage;
import com.nevis.codeindex.model.RepositorySnapshot;
import com.nevis.codeindex.model.RepositoryStatus;
import com.nevis.codeindex.model.SourceFile;
import com.nevis.codeindex.model.TaskStatus;
import com.nevis.codeindex.model.TaskStatusView;
import com.nevis.codeindex.model.TaskType;
import com.nevis.codeindex.parsing.ChunkSplitter;
import com.nevis.codeindex.parsing.SyntaxChunkExtractor;
import com.nevis.codeindex.repository.IndexingTaskRepository;
import com.nevis.codeindex.repository.RepositorySnapshotRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Drives one indexing task through acquire, parse, embed and artifact generation. Every
 * transition is persisted and published; transient failures restart the task from
 * {@code PENDING} a bounded number of times.
 */
@Slf4j
@Service
public class PipelineOrchestrator {

    private static final String TASK_ID = "taskId";

    private final IndexingTaskRepository taskRepository;
    private final RepositorySnapshotRepository repositoryRepository;
    private final RepositoryAcquirer repositoryAcquirer;
    private final ChangeDetector changeDetector;
    private final SyntaxChunkExtractor chunkExtractor;
    private final ChunkSplitter chunkSplitter;
    private final EmbeddingCommitter embeddingCommitter;
    private final StructuralIndexService structuralIndexService;
    private final TaskCredentialStore credentialStore;
    private final ApplicationEventPublisher eventPublisher;
    private final RetryTemplate taskRetryTemplate;
    private final int maxAttempts;

    public PipelineOrchestrator(IndexingTaskRepository taskRepository,
                                RepositorySnapshotRepository repositoryRepository,
                                RepositoryAcquirer repositoryAcquirer,
                                ChangeDetector changeDetector,
                                SyntaxChunkExtractor chunkExtractor,
                                ChunkSplitter chunkSplitter,
                                EmbeddingCommitter embeddingCommitter,
                                StructuralIndexService structuralIndexService,
                                TaskCredentialStore credentialStore,
                                ApplicationEventPublisher eventPublisher,
                                IndexingProperties properties) {
        this.taskRepository = taskRepository;
        this.repositoryRepository = repositoryRepository;
        this.repositoryAcquirer = repositoryAcquirer;
        this.changeDetector = changeDetector;
        this.chunkExtractor = chunkExtractor;
        this.chunkSplitter = chunkSplitter;
        this.embeddingCommitter = embeddingCommitter;
        this.structuralIndexService = structuralIndexService;
        this.credentialStore = credentialStore;
        this.eventPublisher = eventPublisher;
        this.maxAttempts = properties.task().maxAttempts();
        this.taskRetryTemplate = RetryTemplate.builder()
            .maxAttempts(maxAttempts)
            .exponentialBackoff(
                properties.task().initialBackoff().toMillis(),
                2.0,
                properties.task().maxBackoff().toMillis())
            .retryOn(TransientErrors.TYPES)
            .traversingCauses()
            .withListener(new RetryListener() {
                @Override
                public <T, E extends Throwable> void onError(RetryContext context, RetryCallback<T, E> callback, Throwable throwable) {
                    UUID taskId = (UUID) context.getAttribute(TASK_ID);
                    if (taskId != null && TransientErrors.isTransient(throwable) && context.getRetryCount() < maxAttempts) {
                        resetForRetry(taskId, context.getRetryCount(), throwable);
                    }
                }
            })
            .build();
    }

    private static final class StageTracker {
        private PipelineStage current;
    }

    public void run(UUID taskId) {
        IndexingTask task = taskRepository.findById(taskId).orElseThrow(() -> new EntityNotFoundException(taskId));
        if (task.status().isTerminal()) {
            log.info("Task {} is already {}, nothing to run", taskId, task.status());
            return;
        }

        StageTracker tracker = new StageTracker();
        try {
            taskRetryTemplate.execute(context -> {
                context.setAttribute(TASK_ID, taskId);
                attempt(taskId, tracker);
                return null;
            });
        } catch (TaskCancelledException e) {
            log.info("Task {} stopped: {}", taskId, e.getMessage());
            restoreRepositoryStatus(task.repositoryId());
            publish(taskId);
        } catch (RuntimeException e) {
            fail(task, tracker, e);
        } finally {
            credentialStore.remove(taskId);
        }
    }

    private void attempt(UUID taskId, StageTracker tracker) {
        IndexingTask task = taskRepository.findById(taskId).orElseThrow(() -> new TaskCancelledException(taskId));
        RepositorySnapshot repository = repositoryRepository.findById(task.repositoryId())
            .orElseThrow(() -> new TaskCancelledException(taskId));
        UUID repositoryId = repository.id();
        tracker.current = null;

        if (task.type() == TaskType.DERIVED_ONLY) {
            enter(taskId, PipelineStage.GENERATE_ARTIFACTS, tracker);
            structuralIndexService.rebuild(repositoryId);
            complete(taskId, repositoryId);
            return;
        }

        boolean full = task.type() == TaskType.FULL_REINDEX;

        enter(taskId, PipelineStage.ACQUIRE, tracker);
        repositoryRepository.updateStatus(repositoryId,
            repository.lastSyncedAt() == null ? RepositoryStatus.ACQUIRING : RepositoryStatus.SYNCING);
        RepositoryAcquirer.AcquiredRepository acquired =
            repositoryAcquirer.acquire(repository, credentialStore.get(taskId).orElse(null));
        if (!repository.isLocal()) {
            repositoryRepository.updateLocalPath(repositoryId, acquired.root().toString());
        }

        enter(taskId, PipelineStage.PARSE, tracker);
        ChangeSet changes = changeDetector.detect(repositoryId, acquired.root(), full);
        int filesTotal = changes.toProcess().size() + changes.deleted().size();
        taskRepository.updateFileCounters(taskId, filesTotal, 0);

        if (!full && changes.isEmpty()) {
            log.info("Repository {} has no changes, completing task {}", repositoryId, taskId);
            complete(taskId, repositoryId);
            return;
        }

        List<ParsedFile> parsed = parse(taskId, repositoryId, changes.toProcess());
        int chunkCount = parsed.stream().mapToInt(file -> file.chunks().size()).sum();
        if (full && chunkCount == 0) {
            throw new NothingToIndexException(repositoryId);
        }
        checkCancelled(taskId);

        enter(taskId, PipelineStage.EMBED, tracker);
        int deleted = changes.deleted().size();
        EmbeddingCommitter.CommitResult result = embeddingCommitter.commit(
            repositoryId, acquired.revision(), parsed, changes.deleted(), new TaskCommitProgress(taskId, deleted, filesTotal));
        taskRepository.updateFileCounters(taskId, filesTotal, result.filesCommitted() + result.deletedFiles());
        checkCancelled(taskId);

        enter(taskId, PipelineStage.GENERATE_ARTIFACTS, tracker);
        if (full) {
            structuralIndexService.rebuild(repositoryId);
        } else {
            List<String> changedPaths = parsed.stream().map(file -> file.source().relativePath()).toList();
            List<String> deletedPaths = changes.deleted().stream().map(FileCheckpoint::filePath).toList();
            structuralIndexService.patch(repositoryId, changedPaths, deletedPaths);
        }

        complete(taskId, repositoryId);
    }

    private List<ParsedFile> parse(UUID taskId, UUID repositoryId, List<SourceFile> files) {
        List<ParsedFile> parsed = new ArrayList<>(files.size());
        int skipped = 0;
        for (SourceFile file : files) {
            try {
                String source = new String(Files.readAllBytes(file.absolutePath()), StandardCharsets.UTF_8);
                List<ChunkNode> chunks = chunkSplitter.splitAll(chunkExtractor.extract(repositoryId, file, source));
                parsed.add(new ParsedFile(file, chunks));
            } catch (SourceParseException | IOException e) {
                // no checkpoint is written, so the next sync retries the file
                log.warn("Skipping {}: {}", file.relativePath(), SecretScrubber.scrub(e.getMessage()));
                skipped++;
            }
        }
        log.info("Task {}: parsed {} files, skipped {}", taskId, parsed.size(), skipped);
        return parsed;
    }

    private void enter(UUID taskId, PipelineStage stage, StageTracker tracker) {
        TaskStatus current = taskRepository.findStatus(taskId).orElseThrow(() -> new TaskCancelledException(taskId));
        if (!current.canTransitionTo(stage.getStatus())) {
            throw new TaskCancelledException(taskId);
        }
        tracker.current = stage;
        if (!taskRepository.updateProgress(taskId, stage.getStatus(), stage.getStartProgress(), stage.getLabel())) {
            throw new TaskCancelledException(taskId);
        }
        log.info("Task {} entered stage {}", taskId, stage.getStageName());
        publish(taskId);
    }

    private void checkCancelled(UUID taskId) {
        TaskStatus status = taskRepository.findStatus(taskId).orElseThrow(() -> new TaskCancelledException(taskId));
        if (status.isTerminal()) {
            throw new TaskCancelledException(taskId);
        }
    }

    private void complete(UUID taskId, UUID repositoryId) {
        if (!taskRepository.markCompleted(taskId)) {
            throw new TaskCancelledException(taskId);
        }
        repositoryRepository.markSynced(repositoryId);
        log.info("Task {} completed", taskId);
        publish(taskId);
    }

    private void fail(IndexingTask task, StageTracker tracker, RuntimeException error) {
        String stage = tracker.current != null ? tracker.current.getStageName() : PipelineStage.ACQUIRE.getStageName();
        String message = SecretScrubber.scrub(error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName());
        log.error("Task {} failed at stage {}: {}", task.id(), stage, message, error);

        taskRepository.markFailed(task.id(), stage, message);
        repositoryRepository.findById(task.repositoryId())
            .ifPresent(repository -> repositoryRepository.updateStatus(repository.id(), RepositoryStatus.ERROR));
        publish(task.id());
    }

    private void resetForRetry(UUID taskId, int attempt, Throwable error) {
        log.warn("Task {} hit a transient failure (attempt {}/{}), retrying: {}",
            taskId, attempt, maxAttempts, SecretScrubber.scrub(error.getMessage()));
        if (taskRepository.resetForRetry(taskId)) {
            publish(taskId);
        }
    }

    private void restoreRepositoryStatus(UUID repositoryId) {
        repositoryRepository.findById(repositoryId).ifPresent(repository -> repositoryRepository.updateStatus(
            repository.id(), repository.lastSyncedAt() == null ? RepositoryStatus.PENDING : RepositoryStatus.READY));
    }

    private void publish(UUID taskId) {
        taskRepository.findById(taskId)
            .map(TaskStatusView::from)
            .ifPresent(view -> eventPublisher.publishEvent(new TaskProgressEvent(view)));
    }

    private final class TaskCommitProgress implements EmbeddingCommitter.CommitProgress {

        private final UUID taskId;
        private final int alreadyProcessed;
        private final int filesTotal;
        private int lastPublishedPct = -1;

        TaskCommitProgress(UUID taskId, int alreadyProcessed, int filesTotal) {
            this.taskId = taskId;
            this.alreadyProcessed = alreadyProcessed;
            this.filesTotal = filesTotal;
        }

        @Override
        public void checkCancelled() {
            PipelineOrchestrator.this.checkCancelled(taskId);
        }

        @Override
        public void onFileCommitted(int committedFiles, int totalFiles) {
            PipelineStage stage = PipelineStage.EMBED;
            double span = stage.endProgress() - stage.getStartProgress();
            double progress = stage.getStartProgress() + span * committedFiles / Math.max(1, totalFiles);
            int pct = (int) progress;
            taskRepository.updateFileCounters(taskId, filesTotal, alreadyProcessed + committedFiles);
            if (pct != lastPublishedPct) {
                lastPublishedPct = pct;
                taskRepository.updateProgress(taskId, stage.getStatus(), progress,
                    stage.getLabel() + " (" + committedFiles + "/" + totalFiles + " files)");
                publish(taskId);
            }
        }
    }
}
