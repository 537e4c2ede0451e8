package com.nevis.codeindex.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.nevis.codeindex.model.ChunkKind;
import com.nevis.codeindex.model.ChunkNode;
import com.nevis.codeindex.model.DataModelField;

import java.util.List;
import java.util.UUID;

public record ChunkResponse(
    @JsonProperty("chunk_id")
    UUID chunkId,

    @JsonProperty("file_path")
    String filePath,

    ChunkKind kind,

    @JsonProperty("symbol_name")
    String symbolName,

    @JsonProperty("parent_name")
    String parentName,

    String language,

    @JsonProperty("start_line")
    int startLine,

    @JsonProperty("end_line")
    int endLine,

    @JsonProperty("part_index")
    Integer partIndex,

    String content,

    List<String> calls,

    List<String> decorators,

    String docstring,

    @JsonProperty("is_data_model")
    boolean dataModel,

    @JsonProperty("data_model_fields")
    List<DataModelField> dataModelFields
) {
    public static ChunkResponse from(ChunkNode chunk) {
        return new ChunkResponse(
            chunk.id(),
            chunk.filePath(),
            chunk.kind(),
            chunk.symbolName(),
            chunk.parentName(),
            chunk.language(),
            chunk.startLine(),
            chunk.endLine(),
            chunk.partIndex(),
            chunk.content(),
            chunk.calls(),
            chunk.decorators(),
            chunk.docstring(),
            chunk.dataModel(),
            chunk.dataModelFields()
        );
    }
}
