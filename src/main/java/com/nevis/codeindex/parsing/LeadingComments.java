package com.nevis.codeindex.parsing;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

final class LeadingComments {

    private static final Set<String> COMMENT_TYPES = Set.of("comment", "line_comment", "block_comment");

    private LeadingComments() {
    }

    static Optional<String> blockDoc(SyntaxNode anchor, String source) {
        return anchor.previousSibling()
                .filter(LeadingComments::isComment)
                .filter(comment -> comment.endLine() >= anchor.startLine() - 1)
                .map(comment -> comment.text(source).strip())
                .filter(text -> text.startsWith("/**"))
                .map(LeadingComments::stripBlock)
                .filter(text -> !text.isBlank());
    }

    static Optional<String> lineDoc(SyntaxNode anchor, String source, String marker, Predicate<SyntaxNode> skip) {
        Deque<String> lines = new ArrayDeque<>();
        SyntaxNode current = anchor;
        int expectedLine = anchor.startLine() - 1;
        Optional<SyntaxNode> previous = current.previousSibling();
        while (previous.isPresent()) {
            SyntaxNode sibling = previous.get();
            if (skip.test(sibling)) {
                expectedLine = sibling.startLine() - 1;
            } else if (isComment(sibling) && sibling.endLine() == expectedLine
                    && sibling.text(source).strip().startsWith(marker)) {
                lines.addFirst(sibling.text(source).strip().substring(marker.length()).strip());
                expectedLine = sibling.startLine() - 1;
            } else {
                break;
            }
            current = sibling;
            previous = current.previousSibling();
        }
        String doc = String.join("\n", lines).strip();
        return doc.isEmpty() ? Optional.empty() : Optional.of(doc);
    }

    static String stripBlock(String comment) {
        String body = comment.strip();
        if (body.startsWith("/**")) {
            body = body.substring(3);
        }
        if (body.endsWith("*/")) {
            body = body.substring(0, body.length() - 2);
        }
        return body.lines()
                .map(String::strip)
                .map(line -> line.startsWith("*") ? line.substring(1).strip() : line)
                .collect(Collectors.joining("\n"))
                .strip();
    }

    private static boolean isComment(SyntaxNode node) {
        return COMMENT_TYPES.contains(node.type());
    }
}
