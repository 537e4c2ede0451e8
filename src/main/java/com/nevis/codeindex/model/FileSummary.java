package com.nevis.codeindex.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record FileSummary(
    String language,
    @JsonProperty("chunk_count") int chunkCount,
    List<String> functions,
    List<String> classes,
    @JsonProperty("data_models") List<String> dataModels
) {}
