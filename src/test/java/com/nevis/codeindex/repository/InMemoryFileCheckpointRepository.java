package com.nevis.codeindex.repository;

import com.nevis.codeindex.model.FileCheckpoint;

import java.time.OffsetDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryFileCheckpointRepository implements FileCheckpointRepository {

    private record Key(UUID repositoryId, String filePath) {}

    private final Map<Key, FileCheckpoint> checkpoints = new ConcurrentHashMap<>();

    @Override
    public List<FileCheckpoint> findByRepositoryId(UUID repositoryId) {
        return checkpoints.values().stream()
            .filter(checkpoint -> checkpoint.repositoryId().equals(repositoryId))
            .sorted(Comparator.comparing(FileCheckpoint::filePath))
            .toList();
    }

    @Override
    public Optional<FileCheckpoint> findByPath(UUID repositoryId, String filePath) {
        return Optional.ofNullable(checkpoints.get(new Key(repositoryId, filePath)));
    }

    @Override
    public FileCheckpoint upsert(FileCheckpoint checkpoint) {
        Key key = new Key(checkpoint.repositoryId(), checkpoint.filePath());
        FileCheckpoint previous = checkpoints.get(key);
        OffsetDateTime now = OffsetDateTime.now();
        FileCheckpoint stored = new FileCheckpoint(
            previous != null ? previous.id() : UUID.randomUUID(),
            checkpoint.repositoryId(),
            checkpoint.filePath(),
            checkpoint.contentHash(),
            checkpoint.revision(),
            checkpoint.chunkIds(),
            checkpoint.chunkIds().size(),
            previous != null ? previous.createdAt() : now,
            now);
        checkpoints.put(key, stored);
        return stored;
    }

    @Override
    public void invalidate(UUID repositoryId, String filePath) {
        checkpoints.computeIfPresent(new Key(repositoryId, filePath), (key, checkpoint) -> new FileCheckpoint(
            checkpoint.id(), repositoryId, filePath, "", checkpoint.revision(), checkpoint.chunkIds(),
            checkpoint.chunkCount(), checkpoint.createdAt(), OffsetDateTime.now()));
    }

    @Override
    public void deleteByPath(UUID repositoryId, String filePath) {
        checkpoints.remove(new Key(repositoryId, filePath));
    }

    @Override
    public void deleteByRepositoryId(UUID repositoryId) {
        checkpoints.keySet().removeIf(key -> key.repositoryId().equals(repositoryId));
    }
}
