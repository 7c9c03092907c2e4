package com.labpulse.poller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Starts the poller once the application is ready.
 */
@Component
public class PollerBootstrap {
    private static final Logger log = LoggerFactory.getLogger(PollerBootstrap.class);

    private final PollScheduler scheduler;
    private final boolean enabled;
    private final long intervalMs;
    private final long fetchTimeoutMs;

    public PollerBootstrap(
            PollScheduler scheduler,
            @Value("${labpulse.poller.enabled:true}") boolean enabled,
            @Value("${labpulse.poller.interval-ms:30000}") long intervalMs,
            @Value("${labpulse.poller.fetch-timeout-ms:10000}") long fetchTimeoutMs
    ) {
        this.scheduler = scheduler;
        this.enabled = enabled;
        this.intervalMs = intervalMs;
        this.fetchTimeoutMs = fetchTimeoutMs;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!enabled) {
            log.info("Poller disabled by configuration");
            return;
        }
        scheduler.start(PollerConfig.builder()
                .interval(Duration.ofMillis(intervalMs))
                .fetchTimeout(Duration.ofMillis(fetchTimeoutMs))
                .build());
    }
}
