package com.labpulse.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.labpulse.model.MonitorState;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Monitors reported by one integration, for binding cards to monitors.
 */
@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class MonitorListResponse {
    private long integrationId;
    private String integrationName;
    private String serviceType;
    private List<MonitorState> monitors;
}
