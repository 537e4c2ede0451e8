package com.nevis.codeindex.parsing;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

public final class SyntaxNode {

    private final String type;
    private final String name;
    private final int startOffset;
    private final int endOffset;
    private final int startLine;
    private final int endLine;
    private final List<SyntaxNode> children = new ArrayList<>();
    private SyntaxNode parent;

    public SyntaxNode(String type, String name, int startOffset, int endOffset, int startLine, int endLine) {
        this.type = type;
        this.name = name;
        this.startOffset = startOffset;
        this.endOffset = endOffset;
        this.startLine = startLine;
        this.endLine = endLine;
    }

    public SyntaxNode addChild(SyntaxNode child) {
        child.parent = this;
        children.add(child);
        return child;
    }

    public String type() {
        return type;
    }

    public String name() {
        return name;
    }

    public int startOffset() {
        return startOffset;
    }

    public int endOffset() {
        return endOffset;
    }

    public int startLine() {
        return startLine;
    }

    public int endLine() {
        return endLine;
    }

    public SyntaxNode parent() {
        return parent;
    }

    public Optional<SyntaxNode> previousSibling() {
        if (parent == null) {
            return Optional.empty();
        }
        int index = parent.children.indexOf(this);
        return index > 0 ? Optional.of(parent.children.get(index - 1)) : Optional.empty();
    }

    public List<SyntaxNode> children() {
        return Collections.unmodifiableList(children);
    }

    public boolean is(String nodeType) {
        return type.equals(nodeType);
    }

    public String text(String source) {
        return source.substring(startOffset, endOffset);
    }

    public Optional<SyntaxNode> firstChild(String nodeType) {
        return children.stream().filter(child -> child.is(nodeType)).findFirst();
    }

    public List<SyntaxNode> childrenOfType(String nodeType) {
        return children.stream().filter(child -> child.is(nodeType)).toList();
    }

    public void forEachDescendant(Consumer<SyntaxNode> visitor) {
        for (SyntaxNode child : children) {
            visitor.accept(child);
            child.forEachDescendant(visitor);
        }
    }

    @Override
    public String toString() {
        return type + (name != null ? "(" + name + ")" : "") + "[" + startLine + "-" + endLine + "]";
    }
}
