package com.nevis.codeindex.model;

public record EmbeddedChunk(ChunkNode chunk, float[] vector) {}
