package com.nevis.codeindex.exception;

public class TransientProviderException extends RuntimeException {
    public TransientProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
