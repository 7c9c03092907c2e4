package com.labpulse.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.labpulse.model.CycleSummary;
import lombok.Builder;
import lombok.Data;

/**
 * Poller state for diagnostics.
 */
@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PollerStatusResponse {
    private boolean active;
    private boolean cycleInFlight;
    private long intervalMs;
    private long fetchTimeoutMs;
    private int skippedTicks;
    private int metricsClients;
    private int statusClients;
    private int maintenanceClients;
    private CycleSummary lastCycle;
}
