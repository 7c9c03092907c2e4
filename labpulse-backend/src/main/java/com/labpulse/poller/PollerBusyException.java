package com.labpulse.poller;

/**
 * Thrown when an on-demand poll is requested while a cycle is in flight.
 */
public class PollerBusyException extends RuntimeException {
    public PollerBusyException(String message) {
        super(message);
    }
}
