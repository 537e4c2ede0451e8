package com.nevis.codeindex.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record DataModelSummary(
    String name,
    String file,
    @JsonProperty("start_line") int startLine,
    List<DataModelField> fields
) {}
