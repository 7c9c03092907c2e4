package com.labpulse.stream;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The per-topic registries of one process, created once at startup and shared by producers and the
 * streaming endpoint.
 */
public class BroadcastRegistries {

    public static final String METRICS = "metrics";
    public static final String STATUS = "status";
    public static final String MAINTENANCE = "maintenance";

    private final Map<String, StreamBroadcastRegistry> byTopic = new LinkedHashMap<>();

    public BroadcastRegistries(ObjectMapper objectMapper) {
        for (String topic : List.of(METRICS, STATUS, MAINTENANCE)) {
            byTopic.put(topic, new StreamBroadcastRegistry(topic, objectMapper));
        }
    }

    /**
     * @param topic topic name
     * @return the registry for that topic
     * @throws IllegalArgumentException for an unknown topic
     */
    public StreamBroadcastRegistry get(String topic) {
        StreamBroadcastRegistry registry = byTopic.get(topic);
        if (registry == null) {
            throw new IllegalArgumentException("Unknown stream topic: " + topic);
        }
        return registry;
    }

    public int broadcast(String topic, String eventName, Object payload) {
        return get(topic).broadcast(eventName, payload);
    }

    public StreamBroadcastRegistry metrics() {
        return get(METRICS);
    }

    public StreamBroadcastRegistry status() {
        return get(STATUS);
    }

    public StreamBroadcastRegistry maintenance() {
        return get(MAINTENANCE);
    }

    public Collection<StreamBroadcastRegistry> all() {
        return byTopic.values();
    }

    /**
     * Disconnect every client on every topic.
     */
    public void closeAll() {
        byTopic.values().forEach(StreamBroadcastRegistry::closeAll);
    }
}
