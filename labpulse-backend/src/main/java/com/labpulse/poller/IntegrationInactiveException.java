package com.labpulse.poller;

/**
 * Thrown when an on-demand poll targets an integration that is switched off.
 */
public class IntegrationInactiveException extends RuntimeException {
    private final long integrationId;

    public IntegrationInactiveException(long integrationId) {
        super("Integration is inactive: " + integrationId);
        this.integrationId = integrationId;
    }

    public long getIntegrationId() {
        return integrationId;
    }
}
