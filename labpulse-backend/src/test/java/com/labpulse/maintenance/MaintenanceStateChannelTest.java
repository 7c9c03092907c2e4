package com.labpulse.maintenance;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.labpulse.persistence.SettingsRepository;
import com.labpulse.stream.BroadcastRegistries;
import com.labpulse.stream.RecordingStreamClient;
import com.labpulse.stream.StreamEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

class MaintenanceStateChannelTest {

    private final Map<String, String> stored = new HashMap<>();
    private BroadcastRegistries registries;
    private MaintenanceStateChannel channel;

    @BeforeEach
    void setUp() {
        SettingsRepository settings = new SettingsRepository() {
            @Override
            public Optional<String> get(String key) {
                return Optional.ofNullable(stored.get(key));
            }

            @Override
            public void put(String key, String value) {
                stored.put(key, value);
            }
        };
        registries = new BroadcastRegistries(new ObjectMapper());
        channel = new MaintenanceStateChannel(settings, registries);
    }

    @Test
    @DisplayName("The flag is loaded from settings at startup")
    void testLoadsPersistedFlag() {
        stored.put(SettingsRepository.MAINTENANCE_MODE, "true");

        channel.init();

        assertThat(channel.isEnabled()).isTrue();
    }

    @Test
    @DisplayName("A missing setting means maintenance is off")
    void testDefaultsToDisabled() {
        channel.init();

        assertThat(channel.isEnabled()).isFalse();
    }

    @Test
    @DisplayName("Changes are persisted and broadcast, repeats are not")
    void testBroadcastOnlyOnChange() {
        channel.init();
        RecordingStreamClient client = new RecordingStreamClient("banner");
        registries.maintenance().register(client);

        assertThat(channel.setEnabled(true)).isTrue();
        assertThat(channel.setEnabled(true)).isFalse();
        assertThat(channel.setEnabled(false)).isTrue();

        assertThat(stored).containsEntry(SettingsRepository.MAINTENANCE_MODE, "false");
        assertThat(client.eventsNamed(MaintenanceStateChannel.STATE_CHANGE_EVENT))
                .extracting(StreamEvent::data)
                .containsExactly("{\"enabled\":false}", "{\"enabled\":true}", "{\"enabled\":false}");
    }

    @Test
    @DisplayName("New clients receive the current flag on connect")
    void testInitialState() {
        stored.put(SettingsRepository.MAINTENANCE_MODE, "true");
        channel.init();
        RecordingStreamClient client = new RecordingStreamClient("late");

        registries.maintenance().register(client);

        assertThat(client.getEvents()).extracting(StreamEvent::name)
                .containsExactly("connected", MaintenanceStateChannel.STATE_CHANGE_EVENT);
        assertThat(client.getEvents().get(1).data()).isEqualTo("{\"enabled\":true}");
    }
}
