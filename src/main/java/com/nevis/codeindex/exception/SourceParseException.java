package com.nevis.codeindex.exception;

public class SourceParseException extends RuntimeException {
    public SourceParseException(String filePath, String reason) {
        super("Failed to parse " + filePath + ": " + reason);
    }

    public SourceParseException(String filePath, Throwable cause) {
        super("Failed to parse " + filePath + ": " + cause.getMessage(), cause);
    }
}
