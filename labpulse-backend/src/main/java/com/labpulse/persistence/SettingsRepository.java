package com.labpulse.persistence;

import java.util.Optional;

/**
 * Key/value application settings.
 */
public interface SettingsRepository {

    String MAINTENANCE_MODE = "maintenance_mode";
    String STATUS_SOURCE_ID = "status_source_id";

    Optional<String> get(String key);

    void put(String key, String value);
}
