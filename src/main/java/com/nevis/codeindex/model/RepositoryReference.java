package com.nevis.codeindex.model;

import java.nio.file.Path;

public record RepositoryReference(String url, String name, Path localPath) {

    public boolean isLocal() {
        return localPath != null;
    }
}
