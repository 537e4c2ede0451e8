package com.nevis.codeindex.parsing;

import com.nevis.codeindex.model.ChunkKind;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static com.nevis.codeindex.parsing.JavaSyntaxParser.ANNOTATION;
import static com.nevis.codeindex.parsing.JavaSyntaxParser.CLASS;
import static com.nevis.codeindex.parsing.JavaSyntaxParser.CONSTANT;
import static com.nevis.codeindex.parsing.JavaSyntaxParser.CONSTRUCTOR;
import static com.nevis.codeindex.parsing.JavaSyntaxParser.ENUM;
import static com.nevis.codeindex.parsing.JavaSyntaxParser.INTERFACE;
import static com.nevis.codeindex.parsing.JavaSyntaxParser.JAVADOC;
import static com.nevis.codeindex.parsing.JavaSyntaxParser.METHOD;
import static com.nevis.codeindex.parsing.JavaSyntaxParser.METHOD_INVOCATION;
import static com.nevis.codeindex.parsing.JavaSyntaxParser.RECORD;
import static com.nevis.codeindex.parsing.JavaSyntaxParser.SUPERCLASS;
import static com.nevis.codeindex.parsing.JavaSyntaxParser.SUPER_INTERFACES;

@Component
public class JavaGrammar implements LanguageGrammar {

    private final SyntaxParser parser = new JavaSyntaxParser();

    @Override
    public String language() {
        return JavaSyntaxParser.LANGUAGE;
    }

    @Override
    public Set<String> extensions() {
        return Set.of(".java");
    }

    @Override
    public SyntaxParser parser() {
        return parser;
    }

    @Override
    public Set<String> extractableTypes() {
        return Set.of(CLASS, INTERFACE, ENUM, RECORD, METHOD, CONSTRUCTOR, CONSTANT);
    }

    @Override
    public Set<String> wrapperTypes() {
        return Set.of();
    }

    @Override
    public Set<String> decoratorTypes() {
        return Set.of(ANNOTATION);
    }

    @Override
    public Set<String> callTypes() {
        return Set.of(METHOD_INVOCATION);
    }

    @Override
    public ChunkKind kindOf(SyntaxNode node, SyntaxNode enclosing) {
        return switch (node.type()) {
            case CLASS -> ChunkKind.CLASS;
            case INTERFACE -> ChunkKind.INTERFACE;
            case ENUM -> ChunkKind.ENUM;
            case RECORD -> ChunkKind.RECORD;
            case CONSTRUCTOR -> ChunkKind.CONSTRUCTOR;
            case CONSTANT -> ChunkKind.CONSTANT;
            default -> ChunkKind.METHOD;
        };
    }

    @Override
    public Optional<String> callTarget(SyntaxNode call) {
        return Optional.ofNullable(call.name());
    }

    @Override
    public Optional<String> docstringOf(SyntaxNode node, String source) {
        return node.firstChild(JAVADOC)
                .map(javadoc -> LeadingComments.stripBlock(javadoc.text(source)))
                .filter(text -> !text.isBlank());
    }

    @Override
    public String baseTypesText(SyntaxNode node, String source) {
        return Stream.concat(node.childrenOfType(SUPERCLASS).stream(), node.childrenOfType(SUPER_INTERFACES).stream())
                .map(SyntaxNode::name)
                .collect(Collectors.joining(", "));
    }
}
