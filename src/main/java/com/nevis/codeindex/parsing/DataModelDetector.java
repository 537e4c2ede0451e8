package com.nevis.codeindex.parsing;

import com.nevis.codeindex.config.IndexingProperties;
import com.nevis.codeindex.model.DataModelField;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Component
public class DataModelDetector {

    private static final Pattern COLUMN_ASSIGNMENT =
            Pattern.compile("^(\\w+)\\s*(?::[^=]*)?=\\s*(?:\\w+\\.)?(?:Column|mapped_column)\\((.*)\\)", Pattern.DOTALL);
    private static final Pattern LEADING_WORD = Pattern.compile("^\\s*(\\w+)");
    private static final Pattern FOREIGN_KEY = Pattern.compile("ForeignKey\\(\\s*[\"']([^\"']+)[\"']");

    private final List<Pattern> basePatterns;
    private final Set<String> annotations;

    public DataModelDetector(IndexingProperties properties) {
        this.basePatterns = properties.dataModel().baseClasses().stream()
                .map(base -> Pattern.compile("\\b" + Pattern.quote(base) + "\\b"))
                .toList();
        this.annotations = Set.copyOf(properties.dataModel().annotations());
    }

    public boolean isDataModel(String baseTypesText, List<String> decorators) {
        if (baseTypesText != null && !baseTypesText.isBlank()
                && basePatterns.stream().anyMatch(pattern -> pattern.matcher(baseTypesText).find())) {
            return true;
        }
        return decorators.stream().map(DataModelDetector::annotationName).anyMatch(annotations::contains);
    }

    public List<DataModelField> fields(SyntaxNode classNode, String source) {
        List<DataModelField> fields = new ArrayList<>();
        classNode.firstChild(PythonGrammar.BLOCK).ifPresent(block -> {
            for (SyntaxNode statement : block.childrenOfType(PythonGrammar.EXPRESSION_STATEMENT)) {
                statement.firstChild(PythonGrammar.ASSIGNMENT)
                    .map(assignment -> assignment.text(source))
                    .filter(text -> text.contains("Column(") || text.contains("mapped_column("))
                    .flatMap(text -> parseColumn(text.strip()))
                    .ifPresent(fields::add);
            }
        });
        return fields;
    }

    static Optional<DataModelField> parseColumn(String text) {
        Matcher matcher = COLUMN_ASSIGNMENT.matcher(text);
        if (!matcher.lookingAt()) {
            return Optional.empty();
        }
        String arguments = matcher.group(2);
        Matcher type = LEADING_WORD.matcher(arguments);
        Matcher foreignKey = FOREIGN_KEY.matcher(arguments);
        return Optional.of(new DataModelField(
                matcher.group(1),
                type.find() ? type.group(1) : "Unknown",
                arguments.contains("primary_key=True"),
                !arguments.contains("nullable=False"),
                foreignKey.find() ? foreignKey.group(1) : null));
    }

    private static String annotationName(String decorator) {
        String name = decorator.strip();
        if (name.startsWith("@")) {
            name = name.substring(1);
        }
        int paren = name.indexOf('(');
        if (paren >= 0) {
            name = name.substring(0, paren);
        }
        int dot = name.lastIndexOf('.');
        return (dot >= 0 ? name.substring(dot + 1) : name).strip();
    }
}
