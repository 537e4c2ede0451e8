package com.nevis.codeindex.controller;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.UUID;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
    String message,

    @JsonProperty("error_code")
    String errorCode,

    int status,

    long timestamp,

    @JsonProperty("existing_task_id")
    UUID existingTaskId
) {
    public ErrorResponse(String message, String errorCode, int status, long timestamp) {
        this(message, errorCode, status, timestamp, null);
    }
}
