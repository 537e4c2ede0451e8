package com.nevis.codeindex.service;

import com.nevis.codeindex.TestChunks;
import com.nevis.codeindex.model.ChunkKind;
import com.nevis.codeindex.model.ChunkNode;
import com.nevis.codeindex.model.DependencyGraph;
import com.nevis.codeindex.model.FileSummary;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class DependencyGraphBuilderTest {

    private final DependencyGraphBuilder builder = new DependencyGraphBuilder();
    private final UUID repoId = UUID.randomUUID();

    @Test
    @DisplayName("Calls resolve by name across files, without self edges or duplicates")
    void resolvesCallsByName() {
        ChunkNode foo = TestChunks.function(repoId, "a.py", "foo", 1, "bar", "bar", "foo", "missing");
        ChunkNode bar = TestChunks.function(repoId, "b.py", "bar", 1);

        DependencyGraph graph = builder.build(List.of(foo, bar));

        assertThat(graph.totalNodes()).isEqualTo(2);
        assertThat(graph.edges()).containsExactly(new DependencyGraph.Edge(foo.id(), bar.id(), "bar"));
    }

    @Test
    @DisplayName("Ambiguous names connect the caller to every candidate")
    void ambiguousNames() {
        ChunkNode caller = TestChunks.function(repoId, "main.py", "main", 1, "save");
        ChunkNode first = TestChunks.function(repoId, "users.py", "save", 1);
        ChunkNode second = TestChunks.function(repoId, "orders.py", "save", 10);

        DependencyGraph graph = builder.build(List.of(caller, first, second));

        assertThat(graph.edges()).extracting(DependencyGraph.Edge::to).containsExactlyInAnyOrder(first.id(), second.id());
    }

    @Test
    @DisplayName("Only head fragments are call targets")
    void fragmentsAreNotTargets() {
        ChunkNode caller = TestChunks.function(repoId, "a.py", "run", 1, "big");
        ChunkNode head = TestChunks.chunk(repoId, "b.py", "h", ChunkKind.FUNCTION, "big", 1, List.of(), 0);
        ChunkNode tail = TestChunks.chunk(repoId, "b.py", "h", ChunkKind.FUNCTION, "big", 1, List.of(), 1);

        DependencyGraph graph = builder.build(List.of(caller, head, tail));

        assertThat(graph.totalNodes()).isEqualTo(3);
        assertThat(graph.edges()).extracting(DependencyGraph.Edge::to).containsExactly(head.id());
    }

    @Test
    @DisplayName("File prefix filter keeps only nodes and edges inside the prefix")
    void filePrefixFilter() {
        ChunkNode api = TestChunks.function(repoId, "src/api/routes.py", "route", 1, "handle", "log");
        ChunkNode handler = TestChunks.function(repoId, "src/api/handlers.py", "handle", 1);
        ChunkNode logger = TestChunks.function(repoId, "src/util/log.py", "log", 1);

        DependencyGraph graph = builder.build(List.of(api, handler, logger), "src/api/");

        assertThat(graph.nodes()).extracting(DependencyGraph.Node::file)
            .containsExactly("src/api/routes.py", "src/api/handlers.py");
        assertThat(graph.edges()).containsExactly(new DependencyGraph.Edge(api.id(), handler.id(), "handle"));
    }

    @Test
    @DisplayName("Empty chunk set gives an empty graph")
    void emptyInput() {
        DependencyGraph graph = builder.build(List.of());

        assertThat(graph.totalNodes()).isZero();
        assertThat(graph.totalEdges()).isZero();
    }

    @Test
    @DisplayName("File summaries group named heads by kind, ordered by path")
    void fileSummaries() {
        ChunkNode type = TestChunks.chunk(repoId, "z.py", "h", ChunkKind.CLASS, "Widget", 1, List.of(), null);
        ChunkNode method = TestChunks.chunk(repoId, "z.py", "h", ChunkKind.METHOD, "render", 3, List.of(), null);
        ChunkNode function = TestChunks.function(repoId, "a.py", "main", 1);

        Map<String, FileSummary> summaries = builder.fileSummaries(List.of(type, method, function));

        assertThat(summaries.keySet()).containsExactly("a.py", "z.py");
        assertThat(summaries.get("z.py").chunkCount()).isEqualTo(2);
        assertThat(summaries.get("z.py").classes()).containsExactly("Widget");
        assertThat(summaries.get("z.py").functions()).containsExactly("render");
    }
}
