package com.nevis.codeindex.parsing;

import com.nevis.codeindex.model.ChunkKind;
import org.springframework.stereotype.Component;
import org.treesitter.TreeSitterTypescript;

import java.util.HashSet;
import java.util.Set;

@Component
public class TypeScriptGrammar extends JavaScriptGrammar {

    public static final String LANGUAGE = "typescript";

    static final String ABSTRACT_CLASS = "abstract_class_declaration";
    static final String INTERFACE = "interface_declaration";
    static final String TYPE_ALIAS = "type_alias_declaration";
    static final String ENUM = "enum_declaration";

    private final Set<String> extractableTypes;

    public TypeScriptGrammar() {
        super(new TreeSitterSyntaxParser(LANGUAGE, TreeSitterTypescript::new));
        Set<String> types = new HashSet<>(super.extractableTypes());
        types.addAll(Set.of(ABSTRACT_CLASS, INTERFACE, TYPE_ALIAS, ENUM));
        this.extractableTypes = Set.copyOf(types);
    }

    @Override
    public String language() {
        return LANGUAGE;
    }

    @Override
    public Set<String> extensions() {
        return Set.of(".ts", ".tsx", ".mts", ".cts");
    }

    @Override
    public Set<String> extractableTypes() {
        return extractableTypes;
    }

    @Override
    public ChunkKind kindOf(SyntaxNode node, SyntaxNode enclosing) {
        return switch (node.type()) {
            case ABSTRACT_CLASS -> ChunkKind.CLASS;
            case INTERFACE -> ChunkKind.INTERFACE;
            case TYPE_ALIAS -> ChunkKind.TYPE_ALIAS;
            case ENUM -> ChunkKind.ENUM;
            default -> super.kindOf(node, enclosing);
        };
    }
}
