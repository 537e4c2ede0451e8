package com.nevis.codeindex.repository;

import com.nevis.codeindex.model.StructuralIndex;

import java.util.Optional;
import java.util.UUID;

public interface StructuralIndexRepository {
    Optional<StructuralIndex> findByRepositoryId(UUID repositoryId);
    void save(UUID repositoryId, StructuralIndex index);
    void deleteByRepositoryId(UUID repositoryId);
}
