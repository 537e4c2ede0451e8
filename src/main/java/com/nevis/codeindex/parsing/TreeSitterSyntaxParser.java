package com.nevis.codeindex.parsing;

import com.nevis.codeindex.exception.SourceParseException;
import lombok.extern.slf4j.Slf4j;
import org.treesitter.TSLanguage;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Adapts a tree-sitter parse tree to {@link SyntaxNode}s. Only named nodes are carried over,
 * byte offsets are translated to character offsets of the source string.
 */
@Slf4j
public class TreeSitterSyntaxParser implements SyntaxParser {

    private static final Set<String> IDENTIFIER_TYPES =
            Set.of("identifier", "type_identifier", "field_identifier", "property_identifier");
    private static final Set<String> DECLARATOR_TYPES = Set.of("variable_declarator", "pair");
    private static final String ERROR = "ERROR";

    private final String language;
    private final List<String> nameFields;
    private final ThreadLocal<TSParser> parser;

    public TreeSitterSyntaxParser(String language, Supplier<TSLanguage> grammar, List<String> nameFields) {
        this.language = language;
        this.nameFields = List.copyOf(nameFields);
        this.parser = ThreadLocal.withInitial(() -> {
            TSParser created = new TSParser();
            if (!created.setLanguage(grammar.get())) {
                throw new IllegalStateException("Incompatible tree-sitter grammar for " + language);
            }
            return created;
        });
    }

    public TreeSitterSyntaxParser(String language, Supplier<TSLanguage> grammar) {
        this(language, grammar, List.of("name"));
    }

    @Override
    public SyntaxTree parse(String filePath, String source) {
        TSTree tree = parser.get().parseString(null, source);
        if (tree == null || tree.getRootNode().isNull()) {
            throw new SourceParseException(filePath, "tree-sitter produced no syntax tree");
        }
        Conversion conversion = new Conversion(source);
        SyntaxNode root = conversion.convert(tree.getRootNode());
        if (conversion.errors > 0) {
            log.debug("{} has {} unparseable regions, extracting what the {} grammar recognised",
                    filePath, conversion.errors, language);
        }
        return new SyntaxTree(language, source, root);
    }

    private final class Conversion {

        private final byte[] bytes;
        private final int[] charOffsets;
        private final LineIndex lines;
        private int errors;

        Conversion(String source) {
            this.bytes = source.getBytes(StandardCharsets.UTF_8);
            this.charOffsets = charOffsets(source, bytes.length);
            this.lines = new LineIndex(source);
        }

        SyntaxNode convert(TSNode node) {
            if (ERROR.equals(node.getType())) {
                errors++;
            }
            int start = charOffset(node.getStartByte());
            int end = Math.max(start, charOffset(node.getEndByte()));
            SyntaxNode converted = new SyntaxNode(node.getType(), nameOf(node), start, end,
                    lines.lineOf(start), lines.lineOf(Math.max(start, end - 1)));
            for (int i = 0; i < node.getNamedChildCount(); i++) {
                converted.addChild(convert(node.getNamedChild(i)));
            }
            return converted;
        }

        private String nameOf(TSNode node) {
            if (IDENTIFIER_TYPES.contains(node.getType())) {
                return text(node);
            }
            for (String field : nameFields) {
                TSNode named = node.getChildByFieldName(field);
                if (named != null && !named.isNull()) {
                    return text(named);
                }
            }
            TSNode parent = node.getParent();
            if (parent != null && !parent.isNull() && DECLARATOR_TYPES.contains(parent.getType())) {
                TSNode declared = parent.getChildByFieldName(parent.getType().equals("pair") ? "key" : "name");
                if (declared != null && !declared.isNull() && !sameRange(declared, node)) {
                    return text(declared);
                }
            }
            for (int i = 0; i < node.getNamedChildCount(); i++) {
                TSNode child = node.getNamedChild(i);
                if (IDENTIFIER_TYPES.contains(child.getType())) {
                    return text(child);
                }
            }
            if (node.getNamedChildCount() > 0) {
                TSNode first = node.getNamedChild(0);
                TSNode named = first.getChildByFieldName("name");
                if (named != null && !named.isNull()) {
                    return text(named);
                }
            }
            return null;
        }

        private String text(TSNode node) {
            int start = Math.max(0, Math.min(node.getStartByte(), bytes.length));
            int end = Math.max(start, Math.min(node.getEndByte(), bytes.length));
            return new String(bytes, start, end - start, StandardCharsets.UTF_8);
        }

        private int charOffset(int byteOffset) {
            return charOffsets[Math.max(0, Math.min(byteOffset, charOffsets.length - 1))];
        }

        private static boolean sameRange(TSNode a, TSNode b) {
            return a.getStartByte() == b.getStartByte() && a.getEndByte() == b.getEndByte();
        }
    }

    static int[] charOffsets(String source, int byteLength) {
        int[] offsets = new int[byteLength + 1];
        int position = 0;
        int i = 0;
        while (i < source.length() && position < byteLength) {
            int codePoint = source.codePointAt(i);
            int width = utf8Width(codePoint);
            for (int b = 0; b < width && position < byteLength; b++) {
                offsets[position++] = i;
            }
            i += Character.charCount(codePoint);
        }
        while (position <= byteLength) {
            offsets[position++] = source.length();
        }
        return offsets;
    }

    private static int utf8Width(int codePoint) {
        if (codePoint < 0x80) {
            return 1;
        }
        if (codePoint < 0x800) {
            return 2;
        }
        if (codePoint >= Character.MIN_SURROGATE && codePoint <= Character.MAX_SURROGATE) {
            // unpaired surrogates are encoded as '?'
            return 1;
        }
        return codePoint < 0x10000 ? 3 : 4;
    }
}
