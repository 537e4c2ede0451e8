package com.nevis.codeindex.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record DataModelField(
    String name,
    String type,
    @JsonProperty("primary_key") boolean primaryKey,
    boolean nullable,
    @JsonProperty("foreign_key") String foreignKey
) {}
