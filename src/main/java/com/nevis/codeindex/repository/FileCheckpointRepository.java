package com.nevis.codeindex.repository;

import com.nevis.codeindex.model.FileCheckpoint;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface FileCheckpointRepository {
    List<FileCheckpoint> findByRepositoryId(UUID repositoryId);
    Optional<FileCheckpoint> findByPath(UUID repositoryId, String filePath);
    FileCheckpoint upsert(FileCheckpoint checkpoint);
    void invalidate(UUID repositoryId, String filePath);
    void deleteByPath(UUID repositoryId, String filePath);
    void deleteByRepositoryId(UUID repositoryId);
}
