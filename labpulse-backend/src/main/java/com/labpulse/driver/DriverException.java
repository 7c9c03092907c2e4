package com.labpulse.driver;

/**
 * Failure talking to an external service: transport errors, non-2xx responses, unexpected payloads.
 */
public class DriverException extends RuntimeException {
    public DriverException(String message) {
        super(message);
    }

    public DriverException(String message, Throwable cause) {
        super(message, cause);
    }
}
