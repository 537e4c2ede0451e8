package com.nevis.codeindex.parsing;

import com.nevis.codeindex.model.ChunkKind;
import org.springframework.stereotype.Component;
import org.treesitter.TreeSitterPython;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

@Component
public class PythonGrammar implements LanguageGrammar {

    public static final String LANGUAGE = "python";

    static final String MODULE = "module";
    static final String FUNCTION = "function_definition";
    static final String CLASS = "class_definition";
    static final String DECORATED = "decorated_definition";
    static final String DECORATOR = "decorator";
    static final String BLOCK = "block";
    static final String IDENTIFIER = "identifier";
    static final String ATTRIBUTE = "attribute";
    static final String CALL = "call";
    static final String ARGUMENT_LIST = "argument_list";
    static final String ASSIGNMENT = "assignment";
    static final String EXPRESSION_STATEMENT = "expression_statement";
    static final String STRING = "string";

    private static final Pattern CONSTANT_NAME = Pattern.compile("^[A-Z][A-Z0-9_]*$");
    private static final Pattern STRING_PREFIX = Pattern.compile("^[rRuUbBfF]{0,2}");
    private static final Set<String> RECEIVERS = Set.of("self", "cls", "this");

    private final SyntaxParser parser = new TreeSitterSyntaxParser(LANGUAGE, TreeSitterPython::new);

    @Override
    public String language() {
        return LANGUAGE;
    }

    @Override
    public Set<String> extensions() {
        return Set.of(".py");
    }

    @Override
    public SyntaxParser parser() {
        return parser;
    }

    @Override
    public Set<String> extractableTypes() {
        return Set.of(FUNCTION, CLASS);
    }

    @Override
    public Set<String> wrapperTypes() {
        return Set.of(DECORATED);
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
        if (LanguageGrammar.super.isExtractable(node)) {
            return true;
        }
        if (!node.is(ASSIGNMENT) || node.name() == null) {
            return false;
        }
        SyntaxNode statement = node.parent();
        return statement != null && statement.is(EXPRESSION_STATEMENT)
                && statement.parent() != null && statement.parent().is(MODULE)
                && CONSTANT_NAME.matcher(node.name()).matches();
    }

    @Override
    public ChunkKind kindOf(SyntaxNode node, SyntaxNode enclosing) {
        if (node.is(CLASS)) {
            return ChunkKind.CLASS;
        }
        if (node.is(ASSIGNMENT)) {
            return ChunkKind.CONSTANT;
        }
        return enclosing != null && enclosing.is(CLASS) ? ChunkKind.METHOD : ChunkKind.FUNCTION;
    }

    @Override
    public Optional<String> callTarget(SyntaxNode call) {
        for (SyntaxNode child : call.children()) {
            if (child.is(IDENTIFIER)) {
                return receiverFiltered(child.name());
            }
            if (child.is(ATTRIBUTE)) {
                List<SyntaxNode> parts = child.childrenOfType(IDENTIFIER);
                if (!parts.isEmpty()) {
                    return receiverFiltered(parts.get(parts.size() - 1).name());
                }
            }
        }
        return Optional.empty();
    }

    @Override
    public Optional<String> docstringOf(SyntaxNode node, String source) {
        return node.firstChild(BLOCK)
                .flatMap(block -> block.children().stream().findFirst())
                .filter(first -> first.is(EXPRESSION_STATEMENT) && first.firstChild(STRING).isPresent())
                .map(statement -> unquote(statement.text(source)))
                .filter(text -> !text.isBlank());
    }

    @Override
    public String baseTypesText(SyntaxNode node, String source) {
        return node.firstChild(ARGUMENT_LIST).map(arguments -> arguments.text(source)).orElse("");
    }

    private static Optional<String> receiverFiltered(String name) {
        return RECEIVERS.contains(name) ? Optional.empty() : Optional.of(name);
    }

    private static String unquote(String literal) {
        String text = STRING_PREFIX.matcher(literal.strip()).replaceFirst("");
        int quote = text.startsWith("\"\"\"") || text.startsWith("'''") ? 3 : 1;
        if (text.length() < quote * 2) {
            return "";
        }
        return text.substring(quote, text.length() - quote).strip();
    }
}
