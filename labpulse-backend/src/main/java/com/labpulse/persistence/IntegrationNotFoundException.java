package com.labpulse.persistence;

/**
 * Thrown when an integration id does not exist.
 */
public class IntegrationNotFoundException extends RuntimeException {
    public IntegrationNotFoundException(long id) {
        super("Integration not found: " + id);
    }
}
