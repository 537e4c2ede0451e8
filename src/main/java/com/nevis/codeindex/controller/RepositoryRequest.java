package com.nevis.codeindex.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

public record RepositoryRequest(
    @NotBlank
    String url,

    @JsonProperty("force_full")
    boolean forceFull,

    @JsonProperty("access_token")
    String accessToken,

    String branch
) {
    @Override
    public String toString() {
        return "RepositoryRequest[url=" + url + ", forceFull=" + forceFull + ", branch=" + branch + "]";
    }
}
