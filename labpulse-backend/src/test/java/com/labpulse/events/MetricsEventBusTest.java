package com.labpulse.events;

import com.labpulse.model.MetricPayload;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class MetricsEventBusTest {

    private final MetricsEventBus bus = new MetricsEventBus();

    @Test
    @DisplayName("Listeners receive payloads in registration order")
    void testDeliveryOrder() {
        List<String> calls = new ArrayList<>();
        bus.subscribe(p -> calls.add("first:" + p.getIntegrationId()));
        bus.subscribe(p -> calls.add("second:" + p.getIntegrationId()));

        bus.publish(payload(7));

        assertThat(calls).containsExactly("first:7", "second:7");
    }

    @Test
    @DisplayName("A throwing listener is skipped and the rest still receive the payload")
    void testFailingListenerIsolated() {
        List<MetricPayload> received = new ArrayList<>();
        bus.subscribe(p -> {
            throw new IllegalStateException("listener failure");
        });
        bus.subscribe(received::add);

        assertThatCode(() -> bus.publish(payload(1))).doesNotThrowAnyException();
        assertThat(received).hasSize(1);
    }

    @Test
    @DisplayName("Unsubscribe takes effect on the next publish and can be called twice")
    void testUnsubscribe() {
        List<MetricPayload> received = new ArrayList<>();
        Subscription subscription = bus.subscribe(received::add);

        bus.publish(payload(1));
        subscription.unsubscribe();
        subscription.unsubscribe();
        bus.publish(payload(2));

        assertThat(received).extracting(MetricPayload::getIntegrationId).containsExactly(1L);
        assertThat(bus.subscriberCount()).isZero();
    }

    @Test
    @DisplayName("A listener unsubscribing itself during delivery does not disturb the others")
    void testUnsubscribeDuringPublish() {
        List<Long> received = new ArrayList<>();
        Subscription[] self = new Subscription[1];
        self[0] = bus.subscribe(p -> self[0].unsubscribe());
        bus.subscribe(p -> received.add(p.getIntegrationId()));

        bus.publish(payload(1));
        bus.publish(payload(2));

        assertThat(received).containsExactly(1L, 2L);
        assertThat(bus.subscriberCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("The same listener registered twice is delivered twice and removed independently")
    void testDuplicateRegistration() {
        List<MetricPayload> received = new ArrayList<>();
        MetricsListener listener = received::add;
        Subscription first = bus.subscribe(listener);
        bus.subscribe(listener);

        bus.publish(payload(1));
        first.unsubscribe();
        bus.publish(payload(2));

        assertThat(received).extracting(MetricPayload::getIntegrationId).containsExactly(1L, 1L, 2L);
    }

    @Test
    @DisplayName("The latest-metrics cache keeps only the most recent payload per integration")
    void testLatestMetricsCache() {
        LatestMetricsCache cache = new LatestMetricsCache(bus);
        cache.subscribe();

        bus.publish(payload(1));
        MetricPayload newer = payload(1);
        newer.setData(Map.of("cpu", 42.0));
        bus.publish(newer);
        bus.publish(payload(2));

        assertThat(cache.size()).isEqualTo(2);
        assertThat(cache.get(1)).contains(newer);
        assertThat(cache.get(3)).isEmpty();

        cache.unsubscribe();
        assertThat(bus.subscriberCount()).isZero();
    }

    private static MetricPayload payload(long id) {
        return MetricPayload.builder()
                .integrationId(id)
                .integrationName("integration-" + id)
                .integrationType("netdata")
                .data(Map.of())
                .build();
    }
}
