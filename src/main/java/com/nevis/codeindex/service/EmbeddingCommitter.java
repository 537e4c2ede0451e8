package com.nevis.codeindex.service;

import com.nevis.codeindex.config.IndexingProperties;
import com.nevis.codeindex.exception.EmbeddingException;
import com.nevis.codeindex.exception.TaskCancelledException;
import com.nevis.codeindex.infra.SecretScrubber;
import com.nevis.codeindex.model.ChunkNode;
import com.nevis.codeindex.model.EmbeddedChunk;
import com.nevis.codeindex.model.FileCheckpoint;
import com.nevis.codeindex.model.ParsedFile;
import com.nevis.codeindex.parsing.TokenEstimator;
import com.nevis.codeindex.repository.ChunkVectorStore;
import com.nevis.codeindex.repository.FileCheckpointRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorCompletionService;

/**
 * Embeds the chunks of changed files and commits them. A file's checkpoint is written only
 * after every batch carrying one of its chunks has been stored in the vector store; the
 * file's superseded vectors are purged after that.
 */
@Slf4j
@Service
public class EmbeddingCommitter {

    private final EmbeddingService embeddingService;
    private final ChunkVectorStore vectorStore;
    private final FileCheckpointRepository checkpointRepository;
    private final Executor embeddingTaskExecutor;
    private final int batchSize;
    private final int maxBatchTokens;
    private final int maxInFlight;
    private final boolean strict;

    public EmbeddingCommitter(EmbeddingService embeddingService,
                              ChunkVectorStore vectorStore,
                              FileCheckpointRepository checkpointRepository,
                              @Qualifier("embeddingTaskExecutor") Executor embeddingTaskExecutor,
                              IndexingProperties properties) {
        this.embeddingService = embeddingService;
        this.vectorStore = vectorStore;
        this.checkpointRepository = checkpointRepository;
        this.embeddingTaskExecutor = embeddingTaskExecutor;
        this.batchSize = properties.embedding().batchSize();
        this.maxBatchTokens = properties.embedding().maxBatchTokens();
        this.maxInFlight = properties.embedding().maxConcurrency();
        this.strict = properties.embedding().strict();
    }

    public interface CommitProgress {

        void checkCancelled();

        void onFileCommitted(int committedFiles, int totalFiles);

        CommitProgress NONE = new CommitProgress() {
            @Override
            public void checkCancelled() {
            }

            @Override
            public void onFileCommitted(int committedFiles, int totalFiles) {
            }
        };
    }

    public record CommitResult(int filesCommitted, int chunksEmbedded, List<String> skippedFiles, int deletedFiles) {}

    public CommitResult commit(UUID repositoryId, String revision, List<ParsedFile> files,
                               List<FileCheckpoint> deleted, CommitProgress progress) {
        deleted.forEach(checkpoint -> removeFile(repositoryId, checkpoint));
        if (!deleted.isEmpty()) {
            log.info("Removed {} deleted files from repository {}", deleted.size(), repositoryId);
        }

        Run run = new Run(repositoryId, revision, files, progress);
        run.execute();
        log.info("Embedded {} chunks, committed {} files for repository {} ({} skipped)",
            run.chunksEmbedded, run.committed, repositoryId, run.skipped.size());
        return new CommitResult(run.committed, run.chunksEmbedded, List.copyOf(run.skipped), deleted.size());
    }

    public void removeFile(UUID repositoryId, FileCheckpoint checkpoint) {
        vectorStore.deleteByIds(repositoryId, checkpoint.chunkIds());
        vectorStore.deleteByFile(repositoryId, checkpoint.filePath());
        checkpointRepository.deleteByPath(repositoryId, checkpoint.filePath());
        log.debug("Removed {} ({} chunks)", checkpoint.filePath(), checkpoint.chunkIds().size());
    }

    List<List<ChunkNode>> batches(List<ParsedFile> files) {
        List<List<ChunkNode>> batches = new ArrayList<>();
        List<ChunkNode> current = new ArrayList<>();
        int currentTokens = 0;
        for (ParsedFile file : files) {
            for (ChunkNode chunk : file.chunks()) {
                int tokens = TokenEstimator.estimate(chunk.embeddingText());
                if (!current.isEmpty() && (current.size() >= batchSize || currentTokens + tokens > maxBatchTokens)) {
                    batches.add(current);
                    current = new ArrayList<>();
                    currentTokens = 0;
                }
                current.add(chunk);
                currentTokens += tokens;
            }
        }
        if (!current.isEmpty()) {
            batches.add(current);
        }
        return batches;
    }

    private record BatchOutcome(List<ChunkNode> batch, RuntimeException error) {}

    private final class Run {

        private final UUID repositoryId;
        private final String revision;
        private final CommitProgress progress;
        private final Map<String, ParsedFile> filesByPath = new LinkedHashMap<>();
        private final Map<String, Integer> pendingBatches = new HashMap<>();
        private final Set<String> failedFiles = new LinkedHashSet<>();
        private final List<String> skipped = new ArrayList<>();
        private final CompletionService<BatchOutcome> completions = new ExecutorCompletionService<>(embeddingTaskExecutor);
        private int inFlight;
        private int committed;
        private int chunksEmbedded;
        private RuntimeException failure;

        Run(UUID repositoryId, String revision, List<ParsedFile> files, CommitProgress progress) {
            this.repositoryId = repositoryId;
            this.revision = revision;
            this.progress = progress;
            files.forEach(file -> filesByPath.put(file.source().relativePath(), file));
        }

        void execute() {
            List<List<ChunkNode>> batches = batches(List.copyOf(filesByPath.values()));
            for (List<ChunkNode> batch : batches) {
                batch.stream().map(ChunkNode::filePath).distinct()
                    .forEach(path -> pendingBatches.merge(path, 1, Integer::sum));
            }

            // files without chunks have nothing to wait for
            filesByPath.values().stream()
                .filter(file -> file.chunks().isEmpty())
                .toList()
                .forEach(this::commitFile);

            try {
                for (List<ChunkNode> batch : batches) {
                    progress.checkCancelled();
                    if (failure != null) {
                        break;
                    }
                    while (inFlight >= maxInFlight) {
                        handle(next());
                    }
                    completions.submit(() -> embed(batch));
                    inFlight++;
                }
                while (inFlight > 0) {
                    handle(next());
                }
            } catch (TaskCancelledException e) {
                drainWithoutCommitting();
                throw e;
            }

            if (failure != null) {
                throw failure;
            }
        }

        private BatchOutcome embed(List<ChunkNode> batch) {
            try {
                List<float[]> vectors = embeddingService.embedBatch(batch);
                List<EmbeddedChunk> embedded = new ArrayList<>(batch.size());
                for (int i = 0; i < batch.size(); i++) {
                    embedded.add(new EmbeddedChunk(batch.get(i), vectors.get(i)));
                }
                vectorStore.upsert(embedded);
                return new BatchOutcome(batch, null);
            } catch (RuntimeException e) {
                return new BatchOutcome(batch, e);
            }
        }

        private BatchOutcome next() {
            try {
                BatchOutcome outcome = completions.take().get();
                inFlight--;
                return outcome;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new EmbeddingException("Interrupted while waiting for embedding batches", e);
            } catch (ExecutionException e) {
                inFlight--;
                throw new EmbeddingException("Embedding batch crashed: " + SecretScrubber.scrub(e.getMessage()), e.getCause());
            }
        }

        private void handle(BatchOutcome outcome) {
            Set<String> paths = new LinkedHashSet<>();
            outcome.batch().forEach(chunk -> paths.add(chunk.filePath()));

            if (outcome.error() != null) {
                log.error("Embedding batch of {} chunks failed: {}",
                    outcome.batch().size(), SecretScrubber.scrub(outcome.error().getMessage()));
                if (strict && failure == null) {
                    failure = outcome.error();
                }
                failedFiles.addAll(paths);
            } else {
                chunksEmbedded += outcome.batch().size();
            }

            for (String path : paths) {
                int remaining = pendingBatches.merge(path, -1, Integer::sum);
                if (remaining > 0) {
                    continue;
                }
                if (failedFiles.contains(path)) {
                    log.warn("Skipping checkpoint of {}: not every chunk was embedded", path);
                    skipped.add(path);
                } else {
                    commitFile(filesByPath.get(path));
                }
            }
        }

        private void commitFile(ParsedFile file) {
            String path = file.source().relativePath();
            List<UUID> chunkIds = file.chunks().stream().map(ChunkNode::id).toList();
            checkpointRepository.upsert(FileCheckpoint.of(repositoryId, path, file.source().contentHash(), revision, chunkIds));
            vectorStore.deleteSuperseded(repositoryId, path, chunkIds);
            committed++;
            log.debug("Committed checkpoint of {} with {} chunks", path, chunkIds.size());
            progress.onFileCommitted(committed, filesByPath.size());
        }

        private void drainWithoutCommitting() {
            log.info("Cancellation observed, waiting for {} in-flight batches", inFlight);
            while (inFlight > 0) {
                BatchOutcome outcome = next();
                if (outcome.error() == null) {
                    chunksEmbedded += outcome.batch().size();
                }
            }
        }
    }
}
