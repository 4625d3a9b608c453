package com.deepcode.backend.service;

/**
 * Unexpected fault while orchestrating a request; rendered as HTTP 500.
 */
public class ProcessingFailedException extends RuntimeException {

    public ProcessingFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
