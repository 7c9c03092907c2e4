package com.labpulse.status;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.labpulse.crypto.CredentialCodec;
import com.labpulse.driver.Driver;
import com.labpulse.driver.DriverContext;
import com.labpulse.driver.DriverException;
import com.labpulse.driver.DriverFactory;
import com.labpulse.driver.MonitorListing;
import com.labpulse.driver.ServiceType;
import com.labpulse.model.Capability;
import com.labpulse.model.CardStatusMapping;
import com.labpulse.model.ConnectionTestResult;
import com.labpulse.model.DriverCredentials;
import com.labpulse.model.Integration;
import com.labpulse.model.ItemStatus;
import com.labpulse.model.MetricValue;
import com.labpulse.model.MonitorState;
import com.labpulse.persistence.CardStatusMappingRepository;
import com.labpulse.persistence.IntegrationRepository;
import com.labpulse.persistence.SettingsRepository;
import com.labpulse.stream.BroadcastRegistries;
import com.labpulse.stream.RecordingStreamClient;
import com.labpulse.stream.StreamEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class StatusTrackerTest {

    private static final class MonitorDriver implements Driver, MonitorListing {
        private final long id;
        private final List<MonitorState> monitors = new ArrayList<>();
        private boolean unreachable;

        MonitorDriver(long id) {
            this.id = id;
        }

        @Override
        public ServiceType getServiceType() {
            return ServiceType.UPTIME_KUMA;
        }

        @Override
        public long getIntegrationId() {
            return id;
        }

        @Override
        public ConnectionTestResult testConnection() {
            return ConnectionTestResult.ok("ok");
        }

        @Override
        public List<Capability> getCapabilities() {
            return List.of();
        }

        @Override
        public Optional<MetricValue> fetchMetric(String key) {
            return Optional.empty();
        }

        @Override
        public List<MonitorState> fetchMonitorList() {
            if (unreachable) {
                throw new DriverException("connection refused");
            }
            return List.copyOf(monitors);
        }
    }

    private CardStatusMappingRepository cards;
    private SettingsRepository settings;
    private IntegrationRepository integrations;
    private MonitorDriver kuma;
    private BroadcastRegistries registries;
    private StatusTracker tracker;

    @BeforeEach
    void setUp() {
        cards = mock(CardStatusMappingRepository.class);
        settings = mock(SettingsRepository.class);
        integrations = mock(IntegrationRepository.class);
        CredentialCodec codec = mock(CredentialCodec.class);
        when(codec.decrypt(anyString())).thenReturn(DriverCredentials.builder().url("http://kuma").apiKey("k").build());
        when(integrations.findById(anyLong())).thenAnswer(inv -> Optional.of(Integration.builder()
                .id(inv.getArgument(0))
                .serviceName("Kuma")
                .serviceType("uptime-kuma")
                .credentials("blob")
                .active(true)
                .build()));

        kuma = new MonitorDriver(10);
        Map<ServiceType, DriverFactory.DriverConstructor> constructors = new EnumMap<>(ServiceType.class);
        for (ServiceType type : ServiceType.values()) {
            constructors.put(type, (id, credentials, context) -> kuma);
        }
        ObjectMapper mapper = new ObjectMapper();
        DriverFactory factory = new DriverFactory(new DriverContext(HttpClient.newHttpClient(), mapper), constructors);
        registries = new BroadcastRegistries(mapper);

        tracker = new StatusTracker(cards, settings, integrations, codec, factory, registries);
        when(cards.listStatusCards()).thenReturn(List.of(
                CardStatusMapping.builder().cardId(1).monitorName("Plex").build(),
                CardStatusMapping.builder().cardId(2).monitorName("Sonarr").build()));
    }

    @Test
    @DisplayName("Without a status source every status card is warning")
    void testNoSourceConfigured() {
        when(settings.get(SettingsRepository.STATUS_SOURCE_ID)).thenReturn(Optional.empty());

        Map<Long, ItemStatus> changed = tracker.refresh();

        assertThat(changed).containsOnly(entry(1L, ItemStatus.WARNING), entry(2L, ItemStatus.WARNING));
        verifyNoInteractions(integrations);
    }

    @Test
    @DisplayName("Only changed cards are broadcast as a status event")
    void testBroadcastsDiffOnly() {
        when(settings.get(SettingsRepository.STATUS_SOURCE_ID)).thenReturn(Optional.of("10"));
        RecordingStreamClient client = new RecordingStreamClient("viewer");
        registries.status().register(client);

        kuma.monitors.add(MonitorState.up("plex"));
        kuma.monitors.add(MonitorState.up("sonarr"));
        tracker.refresh();

        kuma.monitors.set(1, MonitorState.down("sonarr"));
        tracker.refresh();
        tracker.refresh();

        List<StreamEvent> updates = client.eventsNamed(StatusTracker.STATUS_EVENT);
        assertThat(updates).extracting(StreamEvent::data).containsExactly(
                "{}",
                "{\"1\":\"online\",\"2\":\"online\"}",
                "{\"2\":\"offline\"}");
        assertThat(tracker.currentStatuses()).containsExactly(entry(1L, ItemStatus.ONLINE), entry(2L, ItemStatus.OFFLINE));
    }

    @Test
    @DisplayName("An unreachable source turns its cards to warning")
    void testUnreachableSource() {
        when(settings.get(SettingsRepository.STATUS_SOURCE_ID)).thenReturn(Optional.of("10"));
        kuma.monitors.add(MonitorState.up("plex"));
        tracker.refresh();

        kuma.unreachable = true;
        Map<Long, ItemStatus> changed = tracker.refresh();

        assertThat(changed).containsOnly(entry(1L, ItemStatus.WARNING));
        assertThat(tracker.currentStatuses()).containsEntry(1L, ItemStatus.WARNING).containsEntry(2L, ItemStatus.WARNING);
    }

    @Test
    @DisplayName("New status clients receive the full current map after connecting")
    void testInitialStateOnConnect() {
        when(settings.get(SettingsRepository.STATUS_SOURCE_ID)).thenReturn(Optional.of("10"));
        kuma.monitors.add(MonitorState.down("plex"));
        tracker.refresh();

        RecordingStreamClient late = new RecordingStreamClient("late");
        registries.status().register(late);

        assertThat(late.getEvents()).extracting(StreamEvent::name).containsExactly("connected", "status");
        assertThat(late.getEvents().get(1).data()).isEqualTo("{\"1\":\"offline\",\"2\":\"warning\"}");
    }

    @Test
    @DisplayName("A malformed status source setting is treated as unset")
    void testInvalidSourceSetting() {
        when(settings.get(SettingsRepository.STATUS_SOURCE_ID)).thenReturn(Optional.of("not-a-number"));

        assertThat(tracker.refresh()).containsOnly(entry(1L, ItemStatus.WARNING), entry(2L, ItemStatus.WARNING));
    }
}
