package com.nevis.codeindex.repository;

import com.nevis.codeindex.model.FileCheckpoint;
import com.nevis.codeindex.model.RepositorySnapshot;
import com.nevis.codeindex.model.RepositoryStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class JdbcFileCheckpointRepositoryTest extends BaseIntegrationTest {

    @Autowired
    private FileCheckpointRepository checkpointRepository;

    @Autowired
    private RepositorySnapshotRepository repositoryRepository;

    private UUID repositoryId;

    @BeforeEach
    void setUp() {
        repositoryId = repositoryRepository.save(new RepositorySnapshot(
            null, "https://github.com/acme/" + UUID.randomUUID(), "acme/app", null, null,
            RepositoryStatus.PENDING, null, null, null)).id();
    }

    @Test
    @DisplayName("Upsert stores hash and chunk ids together and replaces them on conflict")
    void shouldUpsertAtomically() {
        UUID first = UUID.randomUUID();
        UUID second = UUID.randomUUID();

        FileCheckpoint created = checkpointRepository.upsert(
            FileCheckpoint.of(repositoryId, "src/app.py", "h1", "abc123", List.of(first, second)));
        assertThat(created.id()).isNotNull();
        assertThat(created.chunkIds()).containsExactly(first, second);
        assertThat(created.chunkCount()).isEqualTo(2);

        UUID third = UUID.randomUUID();
        FileCheckpoint updated = checkpointRepository.upsert(
            FileCheckpoint.of(repositoryId, "src/app.py", "h2", "def456", List.of(third)));

        assertThat(updated.id()).isEqualTo(created.id());
        assertThat(updated.contentHash()).isEqualTo("h2");
        assertThat(updated.revision()).isEqualTo("def456");
        assertThat(updated.chunkIds()).containsExactly(third);
        assertThat(checkpointRepository.findByRepositoryId(repositoryId)).hasSize(1);
    }

    @Test
    @DisplayName("Files without chunks keep an empty id list")
    void shouldStoreEmptyChunkList() {
        checkpointRepository.upsert(FileCheckpoint.of(repositoryId, "empty.py", "h0", "", List.of()));

        FileCheckpoint found = checkpointRepository.findByPath(repositoryId, "empty.py").orElseThrow();
        assertThat(found.chunkIds()).isEmpty();
        assertThat(found.chunkCount()).isZero();
    }

    @Test
    @DisplayName("Invalidation blanks the hash but keeps the chunk ids")
    void shouldInvalidate() {
        UUID chunk = UUID.randomUUID();
        checkpointRepository.upsert(FileCheckpoint.of(repositoryId, "a.py", "h1", "", List.of(chunk)));

        checkpointRepository.invalidate(repositoryId, "a.py");

        FileCheckpoint found = checkpointRepository.findByPath(repositoryId, "a.py").orElseThrow();
        assertThat(found.contentHash()).isEmpty();
        assertThat(found.chunkIds()).containsExactly(chunk);
    }

    @Test
    @DisplayName("Deletes work per path and per repository")
    void shouldDelete() {
        checkpointRepository.upsert(FileCheckpoint.of(repositoryId, "a.py", "h1", "", List.of()));
        checkpointRepository.upsert(FileCheckpoint.of(repositoryId, "b.py", "h2", "", List.of()));

        checkpointRepository.deleteByPath(repositoryId, "a.py");
        assertThat(checkpointRepository.findByRepositoryId(repositoryId))
            .extracting(FileCheckpoint::filePath)
            .containsExactly("b.py");

        checkpointRepository.deleteByRepositoryId(repositoryId);
        assertThat(checkpointRepository.findByRepositoryId(repositoryId)).isEmpty();
    }
}
