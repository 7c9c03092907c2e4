package com.labpulse.persistence;

/**
 * Unchecked wrapper for JDBC failures inside repositories.
 */
public class PersistenceException extends RuntimeException {
    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
