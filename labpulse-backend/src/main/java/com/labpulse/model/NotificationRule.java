package com.labpulse.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Threshold alert on one metric of one integration.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationRule {
    private long id;
    private String name;
    private long integrationId;
    private String metricKey;
    /**
     * Operator tag as stored: {@code gt}, {@code gte}, {@code lt}, {@code lte} or {@code eq}.
     */
    private String operator;
    private double threshold;
    /**
     * Null or non-positive means the default cooldown.
     */
    private Integer cooldownMinutes;
    private String severity;
}
