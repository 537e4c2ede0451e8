package com.nevis.codeindex.service;

import com.nevis.codeindex.model.ChunkNode;
import com.nevis.codeindex.model.DataModelSummary;
import com.nevis.codeindex.model.DependencyGraph;
import com.nevis.codeindex.model.FileSummary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Builds the call graph of a chunk set by matching recorded call names against symbol names.
 * Resolution is name-only: every head chunk carrying the called name becomes a target.
 */
@Slf4j
@Component
public class DependencyGraphBuilder {

    public DependencyGraph build(List<ChunkNode> chunks) {
        return build(chunks, null);
    }

    public DependencyGraph build(List<ChunkNode> chunks, String filePrefix) {
        Map<String, List<ChunkNode>> byName = new HashMap<>();
        for (ChunkNode chunk : chunks) {
            if (chunk.isNamed() && chunk.isHead()) {
                byName.computeIfAbsent(chunk.symbolName(), name -> new ArrayList<>()).add(chunk);
            }
        }

        boolean filtered = filePrefix != null && !filePrefix.isBlank();
        String prefix = filtered ? filePrefix.strip() : "";

        List<DependencyGraph.Node> nodes = new ArrayList<>();
        Set<UUID> included = new HashSet<>();
        for (ChunkNode chunk : chunks) {
            if (filtered && !chunk.filePath().startsWith(prefix)) {
                continue;
            }
            nodes.add(new DependencyGraph.Node(
                chunk.id(),
                chunk.symbolName(),
                chunk.filePath(),
                chunk.kind(),
                chunk.startLine(),
                chunk.endLine(),
                chunk.language(),
                chunk.dataModel(),
                chunk.partIndex()));
            included.add(chunk.id());
        }

        List<DependencyGraph.Edge> edges = new ArrayList<>();
        Set<List<UUID>> seen = new HashSet<>();
        for (ChunkNode caller : chunks) {
            if (!included.contains(caller.id())) {
                continue;
            }
            for (String callName : caller.calls()) {
                for (ChunkNode callee : byName.getOrDefault(callName, List.of())) {
                    if (callee.id().equals(caller.id()) || !included.contains(callee.id())) {
                        continue;
                    }
                    if (seen.add(List.of(caller.id(), callee.id()))) {
                        edges.add(new DependencyGraph.Edge(caller.id(), callee.id(), callName));
                    }
                }
            }
        }

        log.debug("Dependency graph: {} nodes, {} edges", nodes.size(), edges.size());
        return new DependencyGraph(nodes, edges);
    }

    public List<DataModelSummary> dataModels(List<ChunkNode> chunks) {
        return chunks.stream()
            .filter(chunk -> chunk.dataModel() && chunk.isHead())
            .map(chunk -> new DataModelSummary(chunk.symbolName(), chunk.filePath(), chunk.startLine(), chunk.dataModelFields()))
            .toList();
    }

    public Map<String, FileSummary> fileSummaries(List<ChunkNode> chunks) {
        Map<String, List<ChunkNode>> byFile = new LinkedHashMap<>();
        chunks.stream()
            .sorted((a, b) -> a.filePath().compareTo(b.filePath()))
            .forEach(chunk -> byFile.computeIfAbsent(chunk.filePath(), path -> new ArrayList<>()).add(chunk));

        Map<String, FileSummary> summaries = new LinkedHashMap<>();
        byFile.forEach((path, fileChunks) -> {
            List<String> functions = new ArrayList<>();
            List<String> classes = new ArrayList<>();
            List<String> dataModels = new ArrayList<>();
            for (ChunkNode chunk : fileChunks) {
                if (!chunk.isHead() || !chunk.isNamed()) {
                    continue;
                }
                if (chunk.kind().isCallable()) {
                    functions.add(chunk.symbolName());
                } else if (chunk.kind().isType()) {
                    classes.add(chunk.symbolName());
                    if (chunk.dataModel()) {
                        dataModels.add(chunk.symbolName());
                    }
                }
            }
            summaries.put(path, new FileSummary(
                fileChunks.get(0).language(), fileChunks.size(), functions, classes, dataModels));
        });
        return summaries;
    }
}
