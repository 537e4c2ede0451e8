package com.nevis.codeindex.parsing;

import com.nevis.codeindex.model.ChunkKind;
import org.springframework.stereotype.Component;
import org.treesitter.TreeSitterRust;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.Set;

@Component
public class RustGrammar implements LanguageGrammar {

    public static final String LANGUAGE = "rust";

    static final String FUNCTION = "function_item";
    static final String STRUCT = "struct_item";
    static final String ENUM = "enum_item";
    static final String TRAIT = "trait_item";
    static final String IMPL = "impl_item";
    static final String CONST = "const_item";
    static final String ATTRIBUTE = "attribute_item";
    static final String CALL = "call_expression";
    static final String IDENTIFIER = "identifier";
    static final String FIELD_EXPRESSION = "field_expression";
    static final String FIELD_IDENTIFIER = "field_identifier";
    static final String SCOPED_IDENTIFIER = "scoped_identifier";
    static final String SOURCE_FILE = "source_file";

    private final SyntaxParser parser =
            new TreeSitterSyntaxParser(LANGUAGE, TreeSitterRust::new, List.of("name", "type"));

    @Override
    public String language() {
        return LANGUAGE;
    }

    @Override
    public Set<String> extensions() {
        return Set.of(".rs");
    }

    @Override
    public SyntaxParser parser() {
        return parser;
    }

    @Override
    public Set<String> extractableTypes() {
        return Set.of(FUNCTION, STRUCT, ENUM, TRAIT, IMPL, CONST);
    }

    @Override
    public Set<String> wrapperTypes() {
        return Set.of();
    }

    @Override
    public Set<String> decoratorTypes() {
        return Set.of();
    }

    @Override
    public Set<String> callTypes() {
        return Set.of(CALL);
    }

    @Override
    public boolean isExtractable(SyntaxNode node) {
        if (node.is(CONST)) {
            return node.parent() != null && node.parent().is(SOURCE_FILE);
        }
        return LanguageGrammar.super.isExtractable(node);
    }

    @Override
    public List<SyntaxNode> leadingDecorators(SyntaxNode node) {
        Deque<SyntaxNode> attributes = new ArrayDeque<>();
        Optional<SyntaxNode> previous = node.previousSibling();
        while (previous.isPresent() && (previous.get().is(ATTRIBUTE) || isComment(previous.get()))) {
            if (previous.get().is(ATTRIBUTE)) {
                attributes.addFirst(previous.get());
            }
            previous = previous.get().previousSibling();
        }
        return List.copyOf(attributes);
    }

    @Override
    public ChunkKind kindOf(SyntaxNode node, SyntaxNode enclosing) {
        return switch (node.type()) {
            case STRUCT -> ChunkKind.CLASS;
            case ENUM -> ChunkKind.ENUM;
            case TRAIT -> ChunkKind.INTERFACE;
            case IMPL -> ChunkKind.IMPLEMENTATION;
            case CONST -> ChunkKind.CONSTANT;
            default -> enclosing != null && (enclosing.is(IMPL) || enclosing.is(TRAIT))
                    ? ChunkKind.METHOD
                    : ChunkKind.FUNCTION;
        };
    }

    @Override
    public Optional<String> callTarget(SyntaxNode call) {
        if (call.children().isEmpty()) {
            return Optional.empty();
        }
        SyntaxNode callee = call.children().get(0);
        if (callee.is(IDENTIFIER)) {
            return Optional.ofNullable(callee.name());
        }
        if (callee.is(FIELD_EXPRESSION)) {
            return callee.firstChild(FIELD_IDENTIFIER).map(SyntaxNode::name);
        }
        if (callee.is(SCOPED_IDENTIFIER)) {
            List<SyntaxNode> parts = callee.childrenOfType(IDENTIFIER);
            return parts.isEmpty() ? Optional.empty() : Optional.ofNullable(parts.get(parts.size() - 1).name());
        }
        return Optional.empty();
    }

    @Override
    public Optional<String> docstringOf(SyntaxNode node, String source) {
        return LeadingComments.lineDoc(node, source, "///", sibling -> sibling.is(ATTRIBUTE));
    }

    @Override
    public String baseTypesText(SyntaxNode node, String source) {
        return "";
    }

    private static boolean isComment(SyntaxNode node) {
        return node.is("line_comment") || node.is("block_comment");
    }
}
