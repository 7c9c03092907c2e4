package com.labpulse.persistence;

import com.labpulse.model.Integration;
import com.labpulse.model.PollOutcome;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Read access to integrations plus the last-poll write-back used by the poller.
 */
public interface IntegrationRepository {

    /**
     * @return active integrations ordered by service name
     */
    List<Integration> listActiveIntegrations();

    Optional<Integration> findById(long id);

    /**
     * Record the outcome of a poll attempt on a single row.
     *
     * @param id integration id
     * @param outcome outcome
     * @param timestamp time of the attempt
     */
    void updateLastPoll(long id, PollOutcome outcome, Instant timestamp);
}
