package com.labpulse.notification;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes alerts to the application log.
 */
@Component
public class LoggingNotifier implements Notifier {
    private static final Logger log = LoggerFactory.getLogger(LoggingNotifier.class);

    @Override
    public void send(Notification notification) {
        log.warn("Alert [{}] {}: {} (rule_id={}, integration_id={})",
                notification.getSeverity(), notification.getTitle(), notification.getMessage(),
                notification.getRuleId(), notification.getIntegrationId());
    }
}
