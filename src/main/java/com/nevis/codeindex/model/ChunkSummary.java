package com.nevis.codeindex.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.UUID;

public record ChunkSummary(
    @JsonProperty("chunk_id") UUID chunkId,
    @JsonProperty("file_path") String filePath,
    @JsonProperty("start_line") int startLine,
    @JsonProperty("end_line") int endLine,
    @JsonProperty("symbol_name") String symbolName,
    ChunkKind kind,
    double score
) {
    public ChunkSummary {
        if (score < 0 || score > 1.000001) {
            throw new IllegalArgumentException("Invalid similarity score: " + score);
        }
    }
}
