package com.labpulse.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

/**
 * Counters for one integration within one cycle.
 */
@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PollResult {
    private long integrationId;
    private String integrationName;
    private int successCount;
    private int failCount;
    private PollOutcome outcome;
    /**
     * Set when the integration was skipped before any capability was fetched.
     */
    private String skipReason;
}
