package com.nevis.codeindex.parsing;

import com.nevis.codeindex.model.ChunkKind;
import org.springframework.stereotype.Component;
import org.treesitter.TreeSitterJavascript;

import java.util.Optional;
import java.util.Set;

@Component
public class JavaScriptGrammar implements LanguageGrammar {

    public static final String LANGUAGE = "javascript";

    static final String FUNCTION = "function_declaration";
    static final String GENERATOR = "generator_function_declaration";
    static final String ARROW_FUNCTION = "arrow_function";
    static final String CLASS = "class_declaration";
    static final String METHOD = "method_definition";
    static final String EXPORT = "export_statement";
    static final String DECORATOR = "decorator";
    static final String CALL = "call_expression";
    static final String MEMBER = "member_expression";
    static final String IDENTIFIER = "identifier";
    static final String PROPERTY = "property_identifier";
    static final String HERITAGE = "class_heritage";
    static final String DECLARATOR = "variable_declarator";

    private final SyntaxParser parser;

    public JavaScriptGrammar() {
        this(new TreeSitterSyntaxParser(LANGUAGE, TreeSitterJavascript::new));
    }

    protected JavaScriptGrammar(SyntaxParser parser) {
        this.parser = parser;
    }

    @Override
    public String language() {
        return LANGUAGE;
    }

    @Override
    public Set<String> extensions() {
        return Set.of(".js", ".jsx", ".mjs", ".cjs");
    }

    @Override
    public SyntaxParser parser() {
        return parser;
    }

    @Override
    public Set<String> extractableTypes() {
        return Set.of(FUNCTION, GENERATOR, ARROW_FUNCTION, CLASS, METHOD);
    }

    @Override
    public Set<String> wrapperTypes() {
        return Set.of(EXPORT);
    }

    @Override
    public Set<String> decoratorTypes() {
        return Set.of(DECORATOR);
    }

    @Override
    public Set<String> callTypes() {
        return Set.of(CALL);
    }

    @Override
    public boolean isExtractable(SyntaxNode node) {
        if (node.is(ARROW_FUNCTION)) {
            return node.parent() != null && node.parent().is(DECLARATOR) && node.name() != null;
        }
        return LanguageGrammar.super.isExtractable(node);
    }

    @Override
    public ChunkKind kindOf(SyntaxNode node, SyntaxNode enclosing) {
        if (node.is(CLASS)) {
            return ChunkKind.CLASS;
        }
        if (node.is(METHOD)) {
            return "constructor".equals(node.name()) ? ChunkKind.CONSTRUCTOR : ChunkKind.METHOD;
        }
        return ChunkKind.FUNCTION;
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
        if (callee.is(MEMBER)) {
            return callee.firstChild(PROPERTY).map(SyntaxNode::name);
        }
        return Optional.empty();
    }

    @Override
    public Optional<String> docstringOf(SyntaxNode node, String source) {
        return LeadingComments.blockDoc(anchorOf(node), source);
    }

    @Override
    public String baseTypesText(SyntaxNode node, String source) {
        return node.firstChild(HERITAGE).map(heritage -> heritage.text(source)).orElse("");
    }

    protected SyntaxNode anchorOf(SyntaxNode node) {
        SyntaxNode anchor = node;
        if (anchor.is(ARROW_FUNCTION) && anchor.parent() != null && anchor.parent().parent() != null) {
            anchor = anchor.parent().parent();
        }
        if (anchor.parent() != null && anchor.parent().is(EXPORT)) {
            anchor = anchor.parent();
        }
        return anchor;
    }
}
