package com.labpulse.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A configured connection to one external service.
 *
 * <p>Rows are owned by the persistence layer. The poller only reads them and writes the
 * {@code lastPollAt}/{@code lastStatus} fields back.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Integration {
    private long id;
    private String serviceName;
    private String serviceType;
    /**
     * Encrypted credential blob, or null when none has been configured.
     */
    private String credentials;
    private Long pollIntervalMs;
    private boolean active;
    private Instant lastPollAt;
    private PollOutcome lastStatus;

    public boolean hasCredentials() {
        return credentials != null && !credentials.isBlank();
    }
}
