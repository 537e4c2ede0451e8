package com.nevis.codeindex.model;

import java.util.List;

public record ParsedFile(SourceFile source, List<ChunkNode> chunks) {
    public ParsedFile {
        chunks = List.copyOf(chunks);
    }
}
