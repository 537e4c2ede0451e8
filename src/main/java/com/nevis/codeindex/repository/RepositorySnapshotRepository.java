package com.nevis.codeindex.repository;

import com.nevis.codeindex.model.RepositorySnapshot;
import com.nevis.codeindex.model.RepositoryStatus;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface RepositorySnapshotRepository {
    RepositorySnapshot save(RepositorySnapshot repository);
    Optional<RepositorySnapshot> findById(UUID id);
    Optional<RepositorySnapshot> findByUrl(String url);
    List<RepositorySnapshot> findAll();
    void updateStatus(UUID id, RepositoryStatus status);
    void updateLocalPath(UUID id, String localPath);
    void markSynced(UUID id);
    void delete(UUID id);
}
