package com.nevis.codeindex.service;

import com.nevis.codeindex.model.ChunkKind;
import com.nevis.codeindex.model.ChunkNode;
import com.nevis.codeindex.model.StructuralIndex;
import com.nevis.codeindex.repository.ChunkVectorStore;
import com.nevis.codeindex.repository.StructuralIndexRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class StructuralIndexService {

    static final int MAX_RENDERED_FILES = 80;
    private static final int MAX_FUNCTIONS = 15;
    private static final int MAX_CLASSES = 10;
    private static final int MAX_CONSTANTS = 10;

    private final ChunkVectorStore vectorStore;
    private final StructuralIndexRepository indexRepository;

    public StructuralIndex rebuild(UUID repositoryId) {
        StructuralIndex index = build(vectorStore.findChunks(repositoryId));
        indexRepository.save(repositoryId, index);
        log.info("Structural index rebuilt for {}: {} files", repositoryId, index.files().size());
        return index;
    }

    public StructuralIndex patch(UUID repositoryId, Collection<String> changedPaths, Collection<String> deletedPaths) {
        Optional<StructuralIndex> existing = indexRepository.findByRepositoryId(repositoryId);
        if (existing.isEmpty()) {
            return rebuild(repositoryId);
        }

        Map<String, StructuralIndex.FileOutline> files = new TreeMap<>(existing.get().files());
        deletedPaths.forEach(files::remove);
        changedPaths.forEach(files::remove);

        Set<String> changed = Set.copyOf(changedPaths);
        List<ChunkNode> changedChunks = vectorStore.findChunks(repositoryId).stream()
            .filter(chunk -> changed.contains(chunk.filePath()))
            .toList();
        files.putAll(build(changedChunks).files());

        StructuralIndex index = new StructuralIndex(files);
        indexRepository.save(repositoryId, index);
        log.info("Structural index patched for {}: {} changed, {} deleted", repositoryId, changedPaths.size(), deletedPaths.size());
        return index;
    }

    public Optional<StructuralIndex> get(UUID repositoryId) {
        return indexRepository.findByRepositoryId(repositoryId);
    }

    StructuralIndex build(List<ChunkNode> chunks) {
        Map<String, Outline> outlines = new TreeMap<>();
        for (ChunkNode chunk : chunks) {
            Outline outline = outlines.computeIfAbsent(chunk.filePath(), path -> new Outline(chunk.language()));
            if (!chunk.isNamed() || !chunk.isHead()) {
                continue;
            }
            if (chunk.kind() == ChunkKind.CONSTANT) {
                outline.constants.add(chunk.symbolName());
            } else if (chunk.kind().isCallable()) {
                outline.functions.add(chunk.symbolName());
            } else if (chunk.kind().isType()) {
                outline.classes.add(chunk.symbolName());
            }
        }
        Map<String, StructuralIndex.FileOutline> files = new LinkedHashMap<>();
        outlines.forEach((path, outline) -> files.put(path, outline.toFileOutline()));
        return new StructuralIndex(files);
    }

    public String render(StructuralIndex index) {
        if (index.files().isEmpty()) {
            return "";
        }
        StringBuilder text = new StringBuilder("=== CODEBASE INDEX ===\n");
        int rendered = 0;
        for (Map.Entry<String, StructuralIndex.FileOutline> entry : index.files().entrySet()) {
            if (rendered == MAX_RENDERED_FILES) {
                text.append("  ... (").append(index.files().size() - MAX_RENDERED_FILES).append(" more files)\n");
                break;
            }
            rendered++;
            StructuralIndex.FileOutline outline = entry.getValue();
            List<String> parts = new ArrayList<>();
            part(parts, "Functions", outline.functions(), MAX_FUNCTIONS);
            part(parts, "Classes", outline.classes(), MAX_CLASSES);
            part(parts, "Constants", outline.constants(), MAX_CONSTANTS);

            text.append(entry.getKey()).append('\n');
            if (!parts.isEmpty()) {
                text.append("  ").append(String.join(" | ", parts)).append('\n');
            }
        }
        return text.append("=== END CODEBASE INDEX ===").toString();
    }

    private static void part(List<String> parts, String label, List<String> names, int limit) {
        if (!names.isEmpty()) {
            parts.add(label + ": " + String.join(", ", names.subList(0, Math.min(limit, names.size()))));
        }
    }

    private static final class Outline {
        private final String language;
        private final Set<String> functions = new LinkedHashSet<>();
        private final Set<String> classes = new LinkedHashSet<>();
        private final Set<String> constants = new LinkedHashSet<>();

        Outline(String language) {
            this.language = language;
        }

        StructuralIndex.FileOutline toFileOutline() {
            return new StructuralIndex.FileOutline(language, List.copyOf(functions), List.copyOf(classes), List.copyOf(constants));
        }
    }
}
