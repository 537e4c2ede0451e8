package com.nevis.codeindex.parsing;

import com.nevis.codeindex.model.ChunkKind;
import org.springframework.stereotype.Component;
import org.treesitter.TreeSitterGo;

import java.util.List;
import java.util.Optional;
import java.util.Set;

@Component
public class GoGrammar implements LanguageGrammar {

    public static final String LANGUAGE = "go";

    static final String FUNCTION = "function_declaration";
    static final String METHOD = "method_declaration";
    static final String TYPE_DECLARATION = "type_declaration";
    static final String TYPE_SPEC = "type_spec";
    static final String STRUCT = "struct_type";
    static final String INTERFACE = "interface_type";
    static final String CALL = "call_expression";
    static final String SELECTOR = "selector_expression";
    static final String IDENTIFIER = "identifier";
    static final String FIELD_IDENTIFIER = "field_identifier";

    private final SyntaxParser parser = new TreeSitterSyntaxParser(LANGUAGE, TreeSitterGo::new);

    @Override
    public String language() {
        return LANGUAGE;
    }

    @Override
    public Set<String> extensions() {
        return Set.of(".go");
    }

    @Override
    public SyntaxParser parser() {
        return parser;
    }

    @Override
    public Set<String> extractableTypes() {
        return Set.of(FUNCTION, METHOD, TYPE_DECLARATION);
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
    public ChunkKind kindOf(SyntaxNode node, SyntaxNode enclosing) {
        return switch (node.type()) {
            case METHOD -> ChunkKind.METHOD;
            case TYPE_DECLARATION -> {
                Optional<SyntaxNode> spec = node.firstChild(TYPE_SPEC);
                if (spec.flatMap(s -> s.firstChild(STRUCT)).isPresent()) {
                    yield ChunkKind.CLASS;
                }
                yield spec.flatMap(s -> s.firstChild(INTERFACE)).isPresent() ? ChunkKind.INTERFACE : ChunkKind.TYPE_ALIAS;
            }
            default -> ChunkKind.FUNCTION;
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
        if (callee.is(SELECTOR)) {
            List<SyntaxNode> fields = callee.childrenOfType(FIELD_IDENTIFIER);
            return fields.isEmpty() ? Optional.empty() : Optional.ofNullable(fields.get(fields.size() - 1).name());
        }
        return Optional.empty();
    }

    @Override
    public Optional<String> docstringOf(SyntaxNode node, String source) {
        return LeadingComments.lineDoc(node, source, "//", sibling -> false);
    }

    @Override
    public String baseTypesText(SyntaxNode node, String source) {
        return "";
    }
}
