package com.coursegen.core.persistence;

public class RunStateStoreException extends RuntimeException {

    public RunStateStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
