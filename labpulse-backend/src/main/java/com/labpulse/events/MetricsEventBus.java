package com.labpulse.events;

import com.labpulse.model.MetricPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Synchronous in-process publish/subscribe channel for poll results.
 *
 * <p>Listeners run on the publishing thread in registration order. A failing listener is logged and
 * skipped; nothing is buffered or replayed.
 */
@Component
public class MetricsEventBus {
    private static final Logger log = LoggerFactory.getLogger(MetricsEventBus.class);

    private final List<Registration> registrations = new CopyOnWriteArrayList<>();

    /**
     * Deliver a payload to every current listener.
     *
     * @param payload payload
     */
    public void publish(MetricPayload payload) {
        for (Registration registration : registrations) {
            if (!registration.active) {
                continue;
            }
            try {
                registration.listener.onMetrics(payload);
            } catch (Exception e) {
                log.error("Metrics listener failed: listener={}, integration_id={}",
                        registration.listener, payload != null ? payload.getIntegrationId() : null, e);
            }
        }
    }

    /**
     * Register a listener.
     *
     * @param listener listener
     * @return handle to unsubscribe with
     */
    public Subscription subscribe(MetricsListener listener) {
        Registration registration = new Registration(Objects.requireNonNull(listener, "listener"));
        registrations.add(registration);
        return () -> {
            registration.active = false;
            registrations.remove(registration);
        };
    }

    public int subscriberCount() {
        return registrations.size();
    }

    // Identity-based so the same listener can be registered twice and removed independently.
    private static final class Registration {
        private final MetricsListener listener;
        private volatile boolean active = true;

        private Registration(MetricsListener listener) {
            this.listener = listener;
        }
    }
}
