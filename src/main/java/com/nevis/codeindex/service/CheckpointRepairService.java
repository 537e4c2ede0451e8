package com.nevis.codeindex.service;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.nevis.codeindex.model.ChunkNode;
import com.nevis.codeindex.model.FileCheckpoint;
import com.nevis.codeindex.repository.ChunkVectorStore;
import com.nevis.codeindex.repository.FileCheckpointRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class CheckpointRepairService {

    private final FileCheckpointRepository checkpointRepository;
    private final ChunkVectorStore vectorStore;

    public record FileInconsistency(
        @JsonProperty("file_path") String filePath,
        @JsonProperty("missing_chunk_ids") List<UUID> missingChunkIds
    ) {}

    public record ConsistencyReport(
        @JsonProperty("repository_id") UUID repositoryId,
        @JsonProperty("checkpoints_checked") int checkpointsChecked,
        @JsonProperty("inconsistent_files") List<FileInconsistency> inconsistentFiles,
        @JsonProperty("orphan_chunk_ids") List<UUID> orphanChunkIds
    ) {
        public boolean isConsistent() {
            return inconsistentFiles.isEmpty() && orphanChunkIds.isEmpty();
        }
    }

    public record RepairResult(
        @JsonProperty("repository_id") UUID repositoryId,
        @JsonProperty("invalidated_files") List<String> invalidatedFiles,
        @JsonProperty("orphans_deleted") int orphansDeleted
    ) {}

    public record RebuildResult(
        @JsonProperty("repository_id") UUID repositoryId,
        @JsonProperty("checkpoints_written") int checkpointsWritten,
        @JsonProperty("checkpoints_removed") int checkpointsRemoved
    ) {}

    public ConsistencyReport verify(UUID repositoryId) {
        List<FileCheckpoint> checkpoints = checkpointRepository.findByRepositoryId(repositoryId);
        Set<UUID> stored = vectorStore.allIds(repositoryId);

        Set<UUID> referenced = new HashSet<>();
        List<FileInconsistency> inconsistent = new ArrayList<>();
        for (FileCheckpoint checkpoint : checkpoints) {
            referenced.addAll(checkpoint.chunkIds());
            List<UUID> missing = checkpoint.chunkIds().stream().filter(id -> !stored.contains(id)).toList();
            if (!missing.isEmpty()) {
                inconsistent.add(new FileInconsistency(checkpoint.filePath(), missing));
            }
        }
        List<UUID> orphans = stored.stream().filter(id -> !referenced.contains(id)).sorted().toList();

        ConsistencyReport report = new ConsistencyReport(repositoryId, checkpoints.size(), inconsistent, orphans);
        log.info("Consistency check for {}: {} checkpoints, {} inconsistent files, {} orphan chunks",
            repositoryId, checkpoints.size(), inconsistent.size(), orphans.size());
        return report;
    }

    public RepairResult repair(UUID repositoryId) {
        ConsistencyReport report = verify(repositoryId);
        vectorStore.deleteByIds(repositoryId, report.orphanChunkIds());

        List<String> invalidated = new ArrayList<>();
        for (FileInconsistency file : report.inconsistentFiles()) {
            checkpointRepository.invalidate(repositoryId, file.filePath());
            invalidated.add(file.filePath());
        }
        if (!report.isConsistent()) {
            log.warn("Repaired repository {}: {} orphans deleted, {} checkpoints invalidated",
                repositoryId, report.orphanChunkIds().size(), invalidated.size());
        }
        return new RepairResult(repositoryId, invalidated, report.orphanChunkIds().size());
    }

    public RebuildResult rebuildCheckpoints(UUID repositoryId) {
        Map<String, FileCheckpoint> existing = new LinkedHashMap<>();
        checkpointRepository.findByRepositoryId(repositoryId).forEach(checkpoint -> existing.put(checkpoint.filePath(), checkpoint));

        Map<String, Map<String, List<UUID>>> byFileAndHash = new TreeMap<>();
        for (ChunkNode chunk : vectorStore.findChunks(repositoryId)) {
            byFileAndHash
                .computeIfAbsent(chunk.filePath(), path -> new LinkedHashMap<>())
                .computeIfAbsent(chunk.fileHash(), hash -> new ArrayList<>())
                .add(chunk.id());
        }

        int written = 0;
        for (Map.Entry<String, Map<String, List<UUID>>> file : byFileAndHash.entrySet()) {
            String path = file.getKey();
            Map<String, List<UUID>> hashes = file.getValue();
            FileCheckpoint previous = existing.get(path);
            String hash = previous != null && hashes.containsKey(previous.contentHash())
                ? previous.contentHash()
                : hashes.keySet().iterator().next();
            String revision = previous != null ? previous.revision() : "";

            checkpointRepository.upsert(FileCheckpoint.of(repositoryId, path, hash, revision, hashes.get(hash)));
            vectorStore.deleteSuperseded(repositoryId, path, hashes.get(hash));
            written++;
        }

        int removed = 0;
        for (FileCheckpoint checkpoint : existing.values()) {
            // files without chunks legitimately have nothing in the store
            if (!byFileAndHash.containsKey(checkpoint.filePath()) && !checkpoint.chunkIds().isEmpty()) {
                checkpointRepository.deleteByPath(repositoryId, checkpoint.filePath());
                removed++;
            }
        }
        log.info("Rebuilt checkpoints of {} from the vector store: {} written, {} removed", repositoryId, written, removed);
        return new RebuildResult(repositoryId, written, removed);
    }
}
