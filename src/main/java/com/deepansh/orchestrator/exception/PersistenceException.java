package com.deepansh.orchestrator.exception;

/**
 * A write or read against the document store reported failure.
 */
public class PersistenceException extends RuntimeException {

    public PersistenceException(String message) {
        super(message);
    }
}
