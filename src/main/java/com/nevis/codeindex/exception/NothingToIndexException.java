package com.nevis.codeindex.exception;

import java.util.UUID;

public class NothingToIndexException extends RuntimeException {
    public NothingToIndexException(UUID repositoryId) {
        super("No chunks could be extracted from repository " + repositoryId
            + "; make sure it contains files in a supported language");
    }
}
