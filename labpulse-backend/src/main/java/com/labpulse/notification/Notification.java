package com.labpulse.notification;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A triggered alert, ready to hand to a {@link Notifier}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Notification {
    private long ruleId;
    private String title;
    private String message;
    private String severity;
    private long integrationId;
    private String integrationName;
    private String integrationType;
    private String metricKey;
    private double metricValue;
    private double threshold;
    private String operator;
}
