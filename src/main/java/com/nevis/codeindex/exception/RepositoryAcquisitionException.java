package com.nevis.codeindex.exception;

public class RepositoryAcquisitionException extends RuntimeException {
    public RepositoryAcquisitionException(String message, Throwable cause) {
        super(message, cause);
    }

    public RepositoryAcquisitionException(String message) {
        super(message);
    }
}
