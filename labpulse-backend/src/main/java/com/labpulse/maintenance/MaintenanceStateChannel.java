package com.labpulse.maintenance;

import com.labpulse.persistence.SettingsRepository;
import com.labpulse.stream.BroadcastRegistries;
import com.labpulse.stream.StreamBroadcastRegistry;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * The maintenance flag and its {@code maintenance} topic.
 */
@Component
public class MaintenanceStateChannel {
    private static final Logger log = LoggerFactory.getLogger(MaintenanceStateChannel.class);

    public static final String STATE_CHANGE_EVENT = "MT_STATE_CHANGE";

    private final SettingsRepository settingsRepository;
    private final StreamBroadcastRegistry registry;
    private volatile boolean enabled;

    public MaintenanceStateChannel(SettingsRepository settingsRepository, BroadcastRegistries registries) {
        this.settingsRepository = settingsRepository;
        this.registry = registries.maintenance();
    }

    @PostConstruct
    public void init() {
        enabled = settingsRepository.get(SettingsRepository.MAINTENANCE_MODE)
                .map(v -> "true".equalsIgnoreCase(v.trim()))
                .orElse(false);
        registry.setInitialState(() -> registry.event(STATE_CHANGE_EVENT, payload(isEnabled())));
        log.info("Maintenance mode loaded: enabled={}", isEnabled());
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Persist the flag and broadcast it when it differs from the current value. Changes are broadcast in
     * the order they were applied.
     *
     * @param value new flag
     * @return true if the value changed
     */
    public synchronized boolean setEnabled(boolean value) {
        if (enabled == value) {
            return false;
        }
        settingsRepository.put(SettingsRepository.MAINTENANCE_MODE, Boolean.toString(value));
        enabled = value;
        int delivered = registry.broadcast(STATE_CHANGE_EVENT, payload(value));
        log.info("Maintenance mode {}: clients={}", value ? "enabled" : "disabled", delivered);
        return true;
    }

    private static Map<String, Object> payload(boolean value) {
        return Map.of("enabled", value);
    }
}
