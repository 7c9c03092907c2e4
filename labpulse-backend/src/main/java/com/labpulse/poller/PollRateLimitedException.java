package com.labpulse.poller;

/**
 * Thrown when an on-demand poll arrives before the integration's poll interval has elapsed.
 */
public class PollRateLimitedException extends RuntimeException {
    private final long retryAfterSeconds;

    public PollRateLimitedException(long integrationId, long retryAfterSeconds) {
        super("Rate limited: please wait " + retryAfterSeconds + " seconds before polling integration " + integrationId + " again");
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
