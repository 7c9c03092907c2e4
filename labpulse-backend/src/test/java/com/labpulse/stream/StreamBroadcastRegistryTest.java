package com.labpulse.stream;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.*;

class StreamBroadcastRegistryTest {

    private BroadcastRegistries registries;

    @BeforeEach
    void setUp() {
        registries = new BroadcastRegistries(new ObjectMapper());
    }

    @Test
    @DisplayName("Registering sends a connected event carrying the client id")
    void testConnectedGreeting() {
        RecordingStreamClient client = new RecordingStreamClient("client-1");

        assertThat(registries.metrics().register(client)).isTrue();

        assertThat(client.getEvents()).hasSize(1);
        StreamEvent connected = client.getEvents().get(0);
        assertThat(connected.name()).isEqualTo(StreamBroadcastRegistry.CONNECTED_EVENT);
        assertThat(connected.data()).isEqualTo("{\"client_id\":\"client-1\"}");
    }

    @Test
    @DisplayName("Initial state follows the connected event")
    void testInitialState() {
        StreamBroadcastRegistry status = registries.status();
        status.setInitialState(() -> status.event("status", Map.of("4", "online")));
        RecordingStreamClient client = new RecordingStreamClient("c");

        status.register(client);

        assertThat(client.getEvents()).extracting(StreamEvent::name).containsExactly("connected", "status");
        assertThat(client.getEvents().get(1).data()).isEqualTo("{\"4\":\"online\"}");
    }

    @Test
    @DisplayName("A broadcast racing a new client's greeting is delivered after the state snapshot")
    void testBroadcastDuringGreetingIsOrderedAfterSnapshot() throws Exception {
        StreamBroadcastRegistry status = registries.status();
        AtomicReference<Thread> broadcaster = new AtomicReference<>();
        AtomicBoolean broadcastWaited = new AtomicBoolean();
        status.setInitialState(() -> {
            Thread t = new Thread(() -> status.broadcast("status", Map.of("1", "online")));
            broadcaster.set(t);
            t.start();
            try {
                t.join(200);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            broadcastWaited.set(t.isAlive());
            return status.event("status", Map.of("1", "offline"));
        });
        RecordingStreamClient client = new RecordingStreamClient("c");

        assertThat(status.register(client)).isTrue();
        broadcaster.get().join(5_000);

        assertThat(broadcastWaited).isTrue();
        assertThat(client.getEvents()).extracting(StreamEvent::name).containsExactly("connected", "status", "status");
        assertThat(client.eventsNamed("status")).extracting(StreamEvent::data)
                .containsExactly("{\"1\":\"offline\"}", "{\"1\":\"online\"}");
    }

    @Test
    @DisplayName("A failing initial state supplier still greets the client")
    void testInitialStateFailure() {
        StreamBroadcastRegistry status = registries.status();
        status.setInitialState(() -> {
            throw new IllegalStateException("store down");
        });
        RecordingStreamClient client = new RecordingStreamClient("c");

        assertThat(status.register(client)).isTrue();
        assertThat(client.getEvents()).extracting(StreamEvent::name).containsExactly("connected");
    }

    @Test
    @DisplayName("Broadcasting on metrics reaches exactly the three metrics clients and none on other topics")
    void testBroadcastScopedToTopic() {
        List<RecordingStreamClient> metricsClients = List.of(
                new RecordingStreamClient("m1"), new RecordingStreamClient("m2"), new RecordingStreamClient("m3"));
        metricsClients.forEach(registries.metrics()::register);
        RecordingStreamClient statusClient = new RecordingStreamClient("s1");
        RecordingStreamClient maintenanceClient = new RecordingStreamClient("x1");
        registries.status().register(statusClient);
        registries.maintenance().register(maintenanceClient);

        int delivered = registries.broadcast(BroadcastRegistries.METRICS, "metrics", Map.of("integration_id", 1));

        assertThat(delivered).isEqualTo(3);
        for (RecordingStreamClient client : metricsClients) {
            assertThat(client.eventsNamed("metrics")).hasSize(1);
        }
        assertThat(statusClient.eventsNamed("metrics")).isEmpty();
        assertThat(maintenanceClient.eventsNamed("metrics")).isEmpty();
    }

    @Test
    @DisplayName("A client whose write fails is removed and skipped by the next broadcast")
    void testFailedClientRemoved() {
        StreamBroadcastRegistry metrics = registries.metrics();
        RecordingStreamClient healthy = new RecordingStreamClient("ok");
        RecordingStreamClient broken = new RecordingStreamClient("broken");
        metrics.register(healthy);
        metrics.register(broken);
        broken.failNextSends();

        assertThat(metrics.broadcast("metrics", Map.of("n", 1))).isEqualTo(1);
        int attemptsAfterFailure = broken.getSendAttempts();
        assertThat(metrics.broadcast("metrics", Map.of("n", 2))).isEqualTo(1);

        assertThat(broken.getSendAttempts()).isEqualTo(attemptsAfterFailure);
        assertThat(broken.isClosed()).isTrue();
        assertThat(metrics.clientIds()).containsExactly("ok");
        assertThat(healthy.eventsNamed("metrics")).hasSize(2);
    }

    @Test
    @DisplayName("A client failing during the greeting is not kept")
    void testGreetingFailure() {
        RecordingStreamClient broken = new RecordingStreamClient("broken");
        broken.failNextSends();

        assertThat(registries.metrics().register(broken)).isFalse();
        assertThat(registries.metrics().clientCount()).isZero();
    }

    @Test
    @DisplayName("Unregister and closeAll close the clients")
    void testUnregisterAndCloseAll() {
        RecordingStreamClient a = new RecordingStreamClient("a");
        RecordingStreamClient b = new RecordingStreamClient("b");
        registries.metrics().register(a);
        registries.status().register(b);

        registries.metrics().unregister("a");
        registries.metrics().unregister("unknown");
        assertThat(a.isClosed()).isTrue();
        assertThat(registries.metrics().clientCount()).isZero();

        registries.closeAll();
        assertThat(b.isClosed()).isTrue();
        assertThat(registries.status().clientCount()).isZero();
    }

    @Test
    @DisplayName("Keep-alive is sent as a comment")
    void testKeepAlive() {
        RecordingStreamClient client = new RecordingStreamClient("c");
        registries.maintenance().register(client);

        assertThat(registries.maintenance().sendKeepAlive()).isEqualTo(1);

        StreamEvent last = client.getEvents().get(client.getEvents().size() - 1);
        assertThat(last.isComment()).isTrue();
    }

    @Test
    @DisplayName("Unknown topics are rejected")
    void testUnknownTopic() {
        assertThatThrownBy(() -> registries.get("logs")).isInstanceOf(IllegalArgumentException.class);
    }
}
