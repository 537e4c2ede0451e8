package com.nevis.codeindex.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

public record VectorSearchRequest(
    @NotNull
    @JsonProperty("query_vector")
    float[] queryVector,

    @Min(1)
    @Max(100)
    @JsonProperty("top_k")
    Integer topK
) {}
