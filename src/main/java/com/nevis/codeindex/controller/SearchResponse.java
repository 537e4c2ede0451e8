package com.nevis.codeindex.controller;

import com.nevis.codeindex.model.ChunkSummary;

import java.util.List;

public record SearchResponse(
    String query,
    List<ChunkSummary> results
) {}
