package com.deepcode.backend.service.storage;

public class HistoryPersistenceException extends RuntimeException {

    public HistoryPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
