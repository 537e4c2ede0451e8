package com.nevis.codeindex.parsing;

public record SyntaxTree(String language, String source, SyntaxNode root) {}
