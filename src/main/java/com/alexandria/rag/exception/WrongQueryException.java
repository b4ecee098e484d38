package com.alexandria.rag.exception;

public class WrongQueryException extends IllegalArgumentException {

    public WrongQueryException(String message) {
        super(message);
    }
}
