package com.nevis.codeindex.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.UUID;

public record DependencyGraph(List<Node> nodes, List<Edge> edges) {

    public DependencyGraph {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
    }

    public static DependencyGraph empty() {
        return new DependencyGraph(List.of(), List.of());
    }

    @JsonProperty("total_nodes")
    public int totalNodes() {
        return nodes.size();
    }

    @JsonProperty("total_edges")
    public int totalEdges() {
        return edges.size();
    }

    public record Node(
        UUID id,
        String name,
        String file,
        ChunkKind kind,
        @JsonProperty("start_line") int startLine,
        @JsonProperty("end_line") int endLine,
        String language,
        @JsonProperty("is_data_model") boolean dataModel,
        @JsonProperty("part_index") Integer partIndex
    ) {}

    public record Edge(
        UUID from,
        UUID to,
        @JsonProperty("call_name") String callName
    ) {}
}
