package com.nevis.codeindex.controller;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ReindexRequest(
    @JsonProperty("force_full")
    boolean forceFull,

    @JsonProperty("access_token")
    String accessToken
) {
    @Override
    public String toString() {
        return "ReindexRequest[forceFull=" + forceFull + "]";
    }
}
