package com.labpulse.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A metric or data point a driver can report.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Capability {
    private String key;
    private String target;
    private String metric;
    private String displayName;
    private String description;
    private String unit;
    private String category;

    public static Capability of(String key, String displayName, String unit, String category) {
        return Capability.builder()
                .key(key)
                .target(key)
                .metric(key)
                .displayName(displayName)
                .description(displayName)
                .unit(unit)
                .category(category)
                .build();
    }
}
