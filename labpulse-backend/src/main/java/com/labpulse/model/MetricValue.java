package com.labpulse.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * One capability reading returned by a driver.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MetricValue {
    private Instant timestamp;
    /**
     * Number, string or boolean.
     */
    private Object value;
    private String unit;
    private Map<String, Object> metadata;

    public static MetricValue of(Object value, String unit) {
        return MetricValue.builder()
                .timestamp(Instant.now())
                .value(value)
                .unit(unit)
                .metadata(Map.of())
                .build();
    }

    public static MetricValue of(Object value, String unit, Map<String, Object> metadata) {
        return MetricValue.builder()
                .timestamp(Instant.now())
                .value(value)
                .unit(unit)
                .metadata(metadata != null ? metadata : Map.of())
                .build();
    }
}
