package com.nevis.codeindex.exception;

public class WrongQueryException extends RuntimeException {
    public WrongQueryException(String message) {
        super(message);
    }
}
