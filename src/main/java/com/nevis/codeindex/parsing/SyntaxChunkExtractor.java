package com.nevis.codeindex.parsing;

import com.nevis.codeindex.config.IndexingProperties;
import com.nevis.codeindex.model.ChunkKind;
import com.nevis.codeindex.model.ChunkNode;
import com.nevis.codeindex.model.DataModelField;
import com.nevis.codeindex.model.SourceFile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;
import java.util.UUID;

@Slf4j
@Component
public class SyntaxChunkExtractor {

    static final String MODULE_NODE_TYPE = "module";

    private final LanguageRegistry languageRegistry;
    private final DataModelDetector dataModelDetector;
    private final DocumentChunker documentChunker;
    private final int moduleFallbackMaxChars;

    public SyntaxChunkExtractor(LanguageRegistry languageRegistry, DataModelDetector dataModelDetector,
                                DocumentChunker documentChunker, IndexingProperties properties) {
        this.languageRegistry = languageRegistry;
        this.dataModelDetector = dataModelDetector;
        this.documentChunker = documentChunker;
        this.moduleFallbackMaxChars = properties.chunking().moduleFallbackMaxChars();
    }

    public List<ChunkNode> extract(UUID repositoryId, SourceFile file, String source) {
        Optional<LanguageGrammar> grammar = languageRegistry.forLanguage(file.language());
        if (grammar.isEmpty() && DocumentChunker.isDocument(file.relativePath())) {
            return documentChunker.chunk(repositoryId, file, source);
        }
        if (grammar.isEmpty()) {
            log.debug("No grammar for {} ({})", file.relativePath(), file.language());
            return List.of();
        }
        if (source.isBlank()) {
            return List.of();
        }
        SyntaxTree tree = grammar.get().parser().parse(file.relativePath(), source);
        Extraction extraction = new Extraction(repositoryId, file, tree, grammar.get());
        extraction.walk(tree.root(), null, List.of());

        if (extraction.chunks.isEmpty()) {
            extraction.chunks.add(moduleChunk(repositoryId, file, source));
        }
        log.debug("Extracted {} chunks from {}", extraction.chunks.size(), file.relativePath());
        return extraction.chunks;
    }

    private ChunkNode moduleChunk(UUID repositoryId, SourceFile file, String source) {
        String content = source.length() > moduleFallbackMaxChars ? source.substring(0, moduleFallbackMaxChars) : source;
        String name = fileName(file.relativePath());
        int endLine = (int) source.lines().count();
        return new ChunkNode(
            ChunkNode.deriveId(repositoryId, file.relativePath(), file.contentHash(), MODULE_NODE_TYPE, name, 1, 0),
            repositoryId,
            file.relativePath(),
            file.contentHash(),
            ChunkKind.MODULE,
            MODULE_NODE_TYPE,
            name,
            null,
            file.language(),
            1,
            Math.max(1, endLine),
            content,
            List.of(),
            List.of(),
            null,
            false,
            List.of(),
            null
        );
    }

    private static String fileName(String relativePath) {
        int slash = relativePath.lastIndexOf('/');
        return slash >= 0 ? relativePath.substring(slash + 1) : relativePath;
    }

    private final class Extraction {

        private final UUID repositoryId;
        private final SourceFile file;
        private final String source;
        private final LanguageGrammar grammar;
        private final List<ChunkNode> chunks = new ArrayList<>();

        Extraction(UUID repositoryId, SourceFile file, SyntaxTree tree, LanguageGrammar grammar) {
            this.repositoryId = repositoryId;
            this.file = file;
            this.source = tree.source();
            this.grammar = grammar;
        }

        void walk(SyntaxNode node, SyntaxNode enclosing, List<String> pendingDecorators) {
            if (grammar.wrapperTypes().contains(node.type())) {
                List<String> decorators = node.children().stream()
                    .filter(child -> grammar.decoratorTypes().contains(child.type()))
                    .map(child -> child.text(source).strip())
                    .toList();
                for (SyntaxNode child : node.children()) {
                    if (!grammar.decoratorTypes().contains(child.type())) {
                        walk(child, enclosing, grammar.isExtractable(child) ? decorators : List.of());
                    }
                }
                return;
            }
            if (grammar.isExtractable(node)) {
                chunks.add(toChunk(node, enclosing, pendingDecorators));
                for (SyntaxNode child : node.children()) {
                    walk(child, node, List.of());
                }
                return;
            }
            for (SyntaxNode child : node.children()) {
                walk(child, enclosing, List.of());
            }
        }

        private ChunkNode toChunk(SyntaxNode node, SyntaxNode enclosing, List<String> wrapperDecorators) {
            String name = node.name() != null && !node.name().isBlank() ? node.name() : ChunkNode.ANONYMOUS;
            ChunkKind kind = grammar.kindOf(node, enclosing);

            List<String> decorators = new ArrayList<>(wrapperDecorators);
            grammar.leadingDecorators(node).forEach(decorator -> decorators.add(decorator.text(source).strip()));
            node.children().stream()
                .filter(child -> grammar.decoratorTypes().contains(child.type()))
                .map(child -> child.text(source).strip())
                .forEach(decorators::add);

            TreeSet<String> calls = new TreeSet<>();
            node.forEachDescendant(descendant -> {
                if (grammar.callTypes().contains(descendant.type())) {
                    grammar.callTarget(descendant).ifPresent(calls::add);
                }
            });

            boolean dataModel = false;
            List<DataModelField> fields = List.of();
            if (kind.isType()) {
                dataModel = dataModelDetector.isDataModel(grammar.baseTypesText(node, source), decorators);
                if (dataModel && PythonGrammar.LANGUAGE.equals(grammar.language())) {
                    fields = dataModelDetector.fields(node, source);
                }
            }

            return new ChunkNode(
                ChunkNode.deriveId(repositoryId, file.relativePath(), file.contentHash(), node.type(), name,
                    node.startLine(), node.startOffset()),
                repositoryId,
                file.relativePath(),
                file.contentHash(),
                kind,
                node.type(),
                name,
                enclosing != null ? enclosing.name() : null,
                file.language(),
                node.startLine(),
                node.endLine(),
                node.text(source),
                List.copyOf(calls),
                decorators,
                grammar.docstringOf(node, source).orElse(null),
                dataModel,
                fields,
                null
            );
        }
    }
}
