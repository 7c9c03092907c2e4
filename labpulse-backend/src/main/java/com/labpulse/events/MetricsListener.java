package com.labpulse.events;

import com.labpulse.model.MetricPayload;

/**
 * Receives every payload published on the {@link MetricsEventBus}.
 */
@FunctionalInterface
public interface MetricsListener {
    void onMetrics(MetricPayload payload);
}
