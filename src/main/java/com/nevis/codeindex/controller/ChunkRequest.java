package com.nevis.codeindex.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

import java.util.List;
import java.util.UUID;

public record ChunkRequest(
    @NotEmpty
    @Size(max = 200)
    @JsonProperty("chunk_ids")
    List<UUID> chunkIds
) {}
