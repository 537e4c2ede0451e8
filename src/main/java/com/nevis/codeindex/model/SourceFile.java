package com.nevis.codeindex.model;

import java.nio.file.Path;

public record SourceFile(
    String relativePath,
    Path absolutePath,
    String language,
    String contentHash,
    long sizeBytes
) {}
