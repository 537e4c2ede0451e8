package com.nevis.codeindex.parsing;

import com.nevis.codeindex.model.ChunkKind;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Node-type vocabulary of one language. The chunk extractor is generic and only talks to
 * grammars through this interface.
 */
public interface LanguageGrammar {

    String language();

    Set<String> extensions();

    SyntaxParser parser();

    Set<String> extractableTypes();

    /** Node types that wrap an extractable unit and carry its decorators. Never extracted themselves. */
    Set<String> wrapperTypes();

    Set<String> decoratorTypes();

    default List<SyntaxNode> leadingDecorators(SyntaxNode node) {
        return List.of();
    }

    Set<String> callTypes();

    default boolean isExtractable(SyntaxNode node) {
        return extractableTypes().contains(node.type());
    }

    ChunkKind kindOf(SyntaxNode node, SyntaxNode enclosing);

    Optional<String> callTarget(SyntaxNode call);

    default Optional<String> docstringOf(SyntaxNode node, String source) {
        return Optional.empty();
    }

    String baseTypesText(SyntaxNode node, String source);
}
