package com.nevis.codeindex.exception;

public class InvalidRepositoryReferenceException extends RuntimeException {
    public InvalidRepositoryReferenceException(String message) {
        super(message);
    }
}
