package com.labpulse.events;

import com.labpulse.model.MetricPayload;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Bus subscriber remembering the most recent payload per integration.
 */
@Component
public class LatestMetricsCache implements MetricsListener {

    private final MetricsEventBus eventBus;
    private final Map<Long, MetricPayload> latest = new ConcurrentHashMap<>();
    private Subscription subscription;

    public LatestMetricsCache(MetricsEventBus eventBus) {
        this.eventBus = eventBus;
    }

    @PostConstruct
    public void subscribe() {
        subscription = eventBus.subscribe(this);
    }

    @PreDestroy
    public void unsubscribe() {
        if (subscription != null) {
            subscription.unsubscribe();
            subscription = null;
        }
    }

    @Override
    public void onMetrics(MetricPayload payload) {
        if (payload != null) {
            latest.put(payload.getIntegrationId(), payload);
        }
    }

    public Optional<MetricPayload> get(long integrationId) {
        return Optional.ofNullable(latest.get(integrationId));
    }

    public int size() {
        return latest.size();
    }
}
