package com.labpulse.poller;

import lombok.Builder;
import lombok.Data;

import java.time.Duration;

@Data
@Builder
public class PollerConfig {
    public static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(30);
    public static final Duration DEFAULT_FETCH_TIMEOUT = Duration.ofSeconds(10);

    private Duration interval;
    /**
     * Upper bound for a single capability fetch.
     */
    private Duration fetchTimeout;

    public static PollerConfig defaults() {
        return PollerConfig.builder()
                .interval(DEFAULT_INTERVAL)
                .fetchTimeout(DEFAULT_FETCH_TIMEOUT)
                .build();
    }

    /**
     * Fill unset or non-positive values with defaults.
     *
     * @return normalized copy
     */
    public PollerConfig normalized() {
        return PollerConfig.builder()
                .interval(interval == null || interval.isZero() || interval.isNegative() ? DEFAULT_INTERVAL : interval)
                .fetchTimeout(fetchTimeout == null || fetchTimeout.isZero() || fetchTimeout.isNegative()
                        ? DEFAULT_FETCH_TIMEOUT : fetchTimeout)
                .build();
    }
}
