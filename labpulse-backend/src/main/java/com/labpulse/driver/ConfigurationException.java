package com.labpulse.driver;

/**
 * An integration cannot be polled because of how it is configured.
 *
 * <p>The poller marks the integration failed and continues with the next one.
 */
public abstract class ConfigurationException extends RuntimeException {
    protected ConfigurationException(String message) {
        super(message);
    }

    protected ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
