package com.nevis.codeindex.service;

import com.nevis.codeindex.controller.ChunkResponse;
import com.nevis.codeindex.controller.RepositoryResponse;
import com.nevis.codeindex.controller.StructureResponse;
import com.nevis.codeindex.controller.TaskSubmissionResponse;
import com.nevis.codeindex.event.IndexingTaskSubmittedEvent;
import com.nevis.codeindex.event.TaskProgressEvent;
import com.nevis.codeindex.exception.EntityNotFoundException;
import com.nevis.codeindex.exception.TaskConflictException;
import com.nevis.codeindex.exception.WrongQueryException;
import com.nevis.codeindex.model.ChunkSummary;
import com.nevis.codeindex.model.DataModelSummary;
import com.nevis.codeindex.model.DependencyGraph;
import com.nevis.codeindex.model.FileSummary;
import com.nevis.codeindex.model.IndexingTask;
import com.nevis.codeindex.model.RepositoryReference;
import com.nevis.codeindex.model.RepositorySnapshot;
import com.nevis.codeindex.model.RepositoryStatus;
import com.nevis.codeindex.model.StructuralIndex;
import com.nevis.codeindex.model.TaskStatusView;
import com.nevis.codeindex.model.TaskType;
import com.nevis.codeindex.repository.ChunkVectorStore;
import com.nevis.codeindex.repository.FileCheckpointRepository;
import com.nevis.codeindex.repository.IndexingTaskRepository;
import com.nevis.codeindex.repository.RepositorySnapshotRepository;
import com.nevis.codeindex.repository.StructuralIndexRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class IndexingServiceImpl implements IndexingService {

    private static final int MIN_QUERY_LENGTH = 3;
    private static final int MAX_QUERY_LENGTH = 500;
    private static final int MAX_TOP_K = 100;

    private final RepositoryUrlParser urlParser;
    private final RepositorySnapshotRepository repositoryRepository;
    private final IndexingTaskRepository taskRepository;
    private final FileCheckpointRepository checkpointRepository;
    private final StructuralIndexRepository structuralIndexRepository;
    private final ChunkVectorStore vectorStore;
    private final EmbeddingService embeddingService;
    private final DependencyGraphBuilder graphBuilder;
    private final StructuralIndexService structuralIndexService;
    private final CheckpointRepairService repairService;
    private final ProgressStreamService progressStreamService;
    private final RepositoryAcquirer repositoryAcquirer;
    private final TaskCredentialStore credentialStore;
    private final ApplicationEventPublisher eventPublisher;

    @Value("${app.indexing.embedding.dimension:768}")
    private int dimension;

    @Override
    @Transactional
    public TaskSubmissionResponse submit(String repositoryRef, boolean forceFull, String accessToken, String branch) {
        RepositoryReference reference = urlParser.parse(repositoryRef);
        log.debug("Submitting {} (force full: {})", reference.url(), forceFull);

        RepositorySnapshot repository = repositoryRepository.findByUrl(reference.url())
            .orElseGet(() -> {
                RepositorySnapshot created = repositoryRepository.save(new RepositorySnapshot(
                    null,
                    reference.url(),
                    reference.name(),
                    branch == null || branch.isBlank() ? null : branch.strip(),
                    reference.isLocal() ? reference.localPath().toString() : null,
                    RepositoryStatus.PENDING,
                    null,
                    null,
                    null
                ));
                log.info("Registered repository {} as {}", created.url(), created.id());
                return created;
            });

        return startTask(repository, taskType(repository, forceFull), accessToken);
    }

    @Override
    @Transactional
    public TaskSubmissionResponse reindex(UUID repositoryId, boolean forceFull, String accessToken) {
        RepositorySnapshot repository = requireRepository(repositoryId);
        return startTask(repository, taskType(repository, forceFull), accessToken);
    }

    @Override
    @Transactional
    public TaskSubmissionResponse generateArtifacts(UUID repositoryId) {
        return startTask(requireRepository(repositoryId), TaskType.DERIVED_ONLY, null);
    }

    @Override
    @Transactional(readOnly = true)
    public TaskStatusView getStatus(UUID taskId) {
        return taskRepository.findById(taskId)
            .map(TaskStatusView::from)
            .orElseThrow(() -> {
                log.warn("Task not found for ID: {}", taskId);
                return new EntityNotFoundException(taskId);
            });
    }

    @Override
    public SseEmitter streamProgress(UUID taskId) {
        return progressStreamService.subscribe(getStatus(taskId));
    }

    @Override
    public TaskStatusView cancel(UUID taskId) {
        TaskStatusView current = getStatus(taskId);
        if (current.isTerminal()) {
            log.debug("Task {} is already {}", taskId, current.status());
            return current;
        }
        if (taskRepository.markCancelled(taskId)) {
            log.info("Task {} cancelled", taskId);
        }
        TaskStatusView cancelled = getStatus(taskId);
        eventPublisher.publishEvent(new TaskProgressEvent(cancelled));
        return cancelled;
    }

    @Override
    @Transactional(readOnly = true)
    public List<TaskStatusView> getTasks(UUID repositoryId) {
        requireRepository(repositoryId);
        return taskRepository.findByRepositoryId(repositoryId).stream().map(TaskStatusView::from).toList();
    }

    @Override
    public DependencyGraph getDependencyGraph(UUID repositoryId, String fileFilter) {
        requireRepository(repositoryId);
        return graphBuilder.build(vectorStore.findChunks(repositoryId), fileFilter);
    }

    @Override
    public List<ChunkSummary> search(UUID repositoryId, float[] queryVector, int topK) {
        requireRepository(repositoryId);
        validateTopK(topK);
        if (queryVector == null || queryVector.length != dimension) {
            throw new WrongQueryException("Query vector must have " + dimension + " dimensions");
        }
        return vectorStore.search(repositoryId, queryVector, topK);
    }

    @Override
    public List<ChunkSummary> search(UUID repositoryId, String query, int topK) {
        if (query == null || query.strip().length() < MIN_QUERY_LENGTH) {
            throw new WrongQueryException("Query too short");
        }
        if (query.length() > MAX_QUERY_LENGTH) {
            throw new WrongQueryException("Query too long");
        }
        requireRepository(repositoryId);
        validateTopK(topK);
        log.debug("Semantic search in {}: {}", repositoryId, query);
        return vectorStore.search(repositoryId, embeddingService.embedQuery(query), topK);
    }

    @Override
    public List<ChunkResponse> getChunks(UUID repositoryId, List<UUID> chunkIds) {
        requireRepository(repositoryId);
        return vectorStore.findByIds(repositoryId, chunkIds).stream().map(ChunkResponse::from).toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<RepositoryResponse> listRepositories() {
        return repositoryRepository.findAll().stream().map(this::mapToResponse).toList();
    }

    @Override
    @Transactional(readOnly = true)
    public RepositoryResponse getRepository(UUID repositoryId) {
        return mapToResponse(requireRepository(repositoryId));
    }

    @Override
    public void deleteRepository(UUID repositoryId) {
        RepositorySnapshot repository = requireIdleRepository(repositoryId);

        vectorStore.deleteByRepository(repositoryId);
        checkpointRepository.deleteByRepositoryId(repositoryId);
        structuralIndexRepository.deleteByRepositoryId(repositoryId);
        repositoryRepository.delete(repositoryId);
        if (!repository.isLocal()) {
            repositoryAcquirer.deleteWorkspace(repositoryId);
        }
        log.info("Deleted repository {} ({})", repositoryId, repository.url());
    }

    @Override
    public StructureResponse getStructuralIndex(UUID repositoryId) {
        requireRepository(repositoryId);
        StructuralIndex index = structuralIndexService.get(repositoryId).orElse(new StructuralIndex(Map.of()));
        return new StructureResponse(index.files(), structuralIndexService.render(index));
    }

    @Override
    public List<DataModelSummary> getDataModels(UUID repositoryId) {
        requireRepository(repositoryId);
        return graphBuilder.dataModels(vectorStore.findChunks(repositoryId));
    }

    @Override
    public Map<String, FileSummary> getFileSummaries(UUID repositoryId) {
        requireRepository(repositoryId);
        return graphBuilder.fileSummaries(vectorStore.findChunks(repositoryId));
    }

    @Override
    public CheckpointRepairService.ConsistencyReport verify(UUID repositoryId) {
        requireRepository(repositoryId);
        return repairService.verify(repositoryId);
    }

    @Override
    public CheckpointRepairService.RepairResult repair(UUID repositoryId) {
        requireIdleRepository(repositoryId);
        return repairService.repair(repositoryId);
    }

    @Override
    public CheckpointRepairService.RebuildResult rebuildCheckpoints(UUID repositoryId) {
        requireIdleRepository(repositoryId);
        return repairService.rebuildCheckpoints(repositoryId);
    }

    private TaskType taskType(RepositorySnapshot repository, boolean forceFull) {
        return forceFull || repository.lastSyncedAt() == null ? TaskType.FULL_REINDEX : TaskType.INCREMENTAL_SYNC;
    }

    private TaskSubmissionResponse startTask(RepositorySnapshot repository, TaskType type, String accessToken) {
        taskRepository.findActiveByRepositoryId(repository.id()).ifPresent(active -> {
            log.warn("Repository {} already has active task {}", repository.id(), active.id());
            throw new TaskConflictException(repository.id(), active.id());
        });

        IndexingTask task;
        try {
            task = taskRepository.create(repository.id(), type);
        } catch (DuplicateKeyException e) {
            // lost the race against a concurrent submission; the transaction is aborted, so the
            // winner's id cannot be read here
            throw new TaskConflictException(repository.id(), null);
        }

        rememberToken(task.id(), accessToken);
        eventPublisher.publishEvent(new IndexingTaskSubmittedEvent(task.id(), repository.id()));
        log.info("Accepted {} task {} for repository {}", type, task.id(), repository.id());
        return new TaskSubmissionResponse(task.id(), repository.id(), task.type(), task.status());
    }

    private void rememberToken(UUID taskId, String accessToken) {
        if (accessToken == null || accessToken.isBlank()) {
            return;
        }
        credentialStore.put(taskId, accessToken);
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCompletion(int status) {
                    if (status != STATUS_COMMITTED) {
                        credentialStore.remove(taskId);
                    }
                }
            });
        }
    }

    private RepositorySnapshot requireRepository(UUID repositoryId) {
        return repositoryRepository.findById(repositoryId)
            .orElseThrow(() -> {
                log.warn("Repository not found for ID: {}", repositoryId);
                return new EntityNotFoundException(repositoryId);
            });
    }

    private RepositorySnapshot requireIdleRepository(UUID repositoryId) {
        RepositorySnapshot repository = requireRepository(repositoryId);
        taskRepository.findActiveByRepositoryId(repositoryId).ifPresent(active -> {
            throw new TaskConflictException(repositoryId, active.id());
        });
        return repository;
    }

    private void validateTopK(int topK) {
        if (topK < 1 || topK > MAX_TOP_K) {
            throw new WrongQueryException("top_k must be between 1 and " + MAX_TOP_K);
        }
    }

    private RepositoryResponse mapToResponse(RepositorySnapshot repository) {
        UUID activeTaskId = taskRepository.findActiveByRepositoryId(repository.id()).map(IndexingTask::id).orElse(null);
        return new RepositoryResponse(
            repository.id(),
            repository.url(),
            repository.name(),
            repository.defaultBranch(),
            repository.status(),
            activeTaskId,
            repository.lastSyncedAt(),
            repository.createdAt()
        );
    }
}
