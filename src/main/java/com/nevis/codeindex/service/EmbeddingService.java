package com.nevis.codeindex.service;

import com.nevis.codeindex.model.ChunkNode;

import java.util.List;

public interface EmbeddingService {

    List<float[]> embedBatch(List<ChunkNode> chunks);

    float[] embedQuery(String query);
}
