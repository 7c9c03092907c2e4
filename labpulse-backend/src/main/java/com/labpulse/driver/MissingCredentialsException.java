package com.labpulse.driver;

/**
 * Thrown when an integration has no credential blob or a required credential field is empty.
 */
public class MissingCredentialsException extends ConfigurationException {
    public MissingCredentialsException(String message) {
        super(message);
    }
}
