package com.nevis.codeindex.repository;

import com.nevis.codeindex.model.ChunkKind;
import com.nevis.codeindex.model.ChunkNode;
import com.nevis.codeindex.model.ChunkSummary;
import com.nevis.codeindex.model.DataModelField;
import com.nevis.codeindex.model.EmbeddedChunk;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PgVectorChunkStoreTest extends BaseIntegrationTest {

    @Autowired
    private ChunkVectorStore vectorStore;

    private final UUID repositoryId = UUID.randomUUID();

    private ChunkNode chunk(String file, String name, int line, Integer partIndex) {
        UUID unitId = ChunkNode.deriveId(repositoryId, file, "h-" + file, "function_definition", name, line, 0);
        return new ChunkNode(
            partIndex == null ? unitId : ChunkNode.fragmentId(unitId, partIndex),
            repositoryId, file, "h-" + file, ChunkKind.FUNCTION, "function_definition", name, null, "python",
            line, line + 3, "def " + name + "():\n    return helper()\n",
            List.of("helper"), List.of("@cached"), "Docs for " + name, false, List.of(), partIndex);
    }

    @Test
    @DisplayName("Stored chunks round-trip with their metadata")
    void shouldStoreChunkMetadata() {
        ChunkNode model = new ChunkNode(
            ChunkNode.deriveId(repositoryId, "models.py", "h-m", "class_definition", "User", 1, 0),
            repositoryId, "models.py", "h-m", ChunkKind.CLASS, "class_definition", "User", null, "python",
            1, 5, "class User(Base):\n    id = Column(Integer)\n", List.of("Column"), List.of(), null, true,
            List.of(new DataModelField("id", "Integer", true, false, null)), null);
        vectorStore.upsert(List.of(new EmbeddedChunk(model, unitVector(0))));

        ChunkNode found = vectorStore.findByIds(repositoryId, List.of(model.id())).get(0);

        assertThat(found.dataModel()).isTrue();
        assertThat(found.dataModelFields()).containsExactly(new DataModelField("id", "Integer", true, false, null));
        assertThat(found.calls()).containsExactly("Column");
        assertThat(found.partIndex()).isNull();
        assertThat(found.content()).isEqualTo(model.content());
    }

    @Test
    @DisplayName("Search ranks by cosine similarity within one repository")
    void shouldRankBySimilarity() {
        ChunkNode close = chunk("a.py", "close", 1, null);
        ChunkNode far = chunk("b.py", "far", 1, null);
        vectorStore.upsert(List.of(
            new EmbeddedChunk(close, unitVector(0)),
            new EmbeddedChunk(far, unitVector(1))));

        ChunkNode foreign = new ChunkNode(UUID.randomUUID(), UUID.randomUUID(), "a.py", "h", ChunkKind.FUNCTION,
            "function_definition", "close", null, "python", 1, 2, "x", List.of(), List.of(), null, false, List.of(), null);
        vectorStore.upsert(List.of(new EmbeddedChunk(foreign, unitVector(0))));

        List<ChunkSummary> results = vectorStore.search(repositoryId, unitVector(0), 5);

        assertThat(results).extracting(ChunkSummary::chunkId).containsExactly(close.id(), far.id());
        assertThat(results.get(0).score()).isCloseTo(1.0, within(1e-6));
        assertThat(results.get(1).score()).isCloseTo(0.0, within(1e-6));
    }

    @Test
    @DisplayName("Superseded chunks of a file are purged, live ones and other files kept")
    void shouldPurgeSuperseded() {
        ChunkNode live = chunk("a.py", "live", 1, null);
        ChunkNode stale = chunk("a.py", "stale", 10, null);
        ChunkNode other = chunk("b.py", "other", 1, null);
        vectorStore.upsert(List.of(
            new EmbeddedChunk(live, unitVector(0)),
            new EmbeddedChunk(stale, unitVector(1)),
            new EmbeddedChunk(other, unitVector(2))));

        vectorStore.deleteSuperseded(repositoryId, "a.py", List.of(live.id()));

        assertThat(vectorStore.allIds(repositoryId)).containsExactlyInAnyOrder(live.id(), other.id());
        assertThat(vectorStore.existingIds(repositoryId, List.of(live.id(), stale.id()))).containsExactly(live.id());
    }

    @Test
    @DisplayName("Fragments are listed after their head in line order")
    void shouldOrderFragments() {
        ChunkNode second = chunk("big.py", "huge", 1, 1);
        ChunkNode first = chunk("big.py", "huge", 1, 0);
        vectorStore.upsert(List.of(new EmbeddedChunk(second, unitVector(3)), new EmbeddedChunk(first, unitVector(4))));

        assertThat(vectorStore.findChunks(repositoryId))
            .extracting(ChunkNode::partIndex)
            .containsExactly(0, 1);

        vectorStore.deleteByRepository(repositoryId);
        assertThat(vectorStore.allIds(repositoryId)).isEmpty();
    }
}
