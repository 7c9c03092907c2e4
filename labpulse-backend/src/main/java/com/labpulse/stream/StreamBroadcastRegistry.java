package com.labpulse.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Set of streaming clients connected to one topic.
 *
 * <p>All access to the client set goes through one lock, and events are handed to clients while holding
 * it, so every client sees events in the order they were broadcast. {@link StreamClient#send} only
 * enqueues. A client whose send fails is removed, then closed after the lock is released.
 */
public class StreamBroadcastRegistry {
    private static final Logger log = LoggerFactory.getLogger(StreamBroadcastRegistry.class);

    public static final String CONNECTED_EVENT = "connected";

    private final String topic;
    private final ObjectMapper objectMapper;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, StreamClient> clients = new LinkedHashMap<>();
    private volatile Supplier<StreamEvent> initialState;

    public StreamBroadcastRegistry(String topic, ObjectMapper objectMapper) {
        this.topic = Objects.requireNonNull(topic, "topic");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    public String getTopic() {
        return topic;
    }

    /**
     * Set the event sent to every new client right after {@code connected}.
     *
     * @param initialState supplier of the current state; may return null to send nothing
     */
    public void setInitialState(Supplier<StreamEvent> initialState) {
        this.initialState = initialState;
    }

    /**
     * Register a client and queue the {@code connected} event and the current state for it.
     *
     * <p>The greeting is queued under the registry lock, so no broadcast can reach the client before it
     * and the state snapshot is never older than a broadcast the client already received.
     *
     * @param client client
     * @return true if the client is registered after the greeting was handed over
     */
    public boolean register(StreamClient client) {
        List<StreamClient> failed = new ArrayList<>();
        boolean registered;
        lock.lock();
        try {
            StreamClient previous = clients.put(client.getClientId(), client);
            if (previous != null && previous != client) {
                failed.add(previous);
            }

            registered = deliverLocked(client, event(CONNECTED_EVENT, Map.of("client_id", client.getClientId())), failed);
            Supplier<StreamEvent> state = initialState;
            if (registered && state != null) {
                StreamEvent current = initialStateEvent(state);
                if (current != null) {
                    registered = deliverLocked(client, current, failed);
                }
            }
        } finally {
            lock.unlock();
        }
        failed.forEach(StreamClient::close);

        if (registered) {
            log.info("Stream client connected: topic={}, client_id={}, clients={}", topic, client.getClientId(), clientCount());
        }
        return registered;
    }

    /**
     * Remove a client, typically because its connection ended.
     *
     * @param clientId client id
     */
    public void unregister(String clientId) {
        StreamClient removed;
        lock.lock();
        try {
            removed = clients.remove(clientId);
        } finally {
            lock.unlock();
        }
        if (removed != null) {
            removed.close();
            log.info("Stream client disconnected: topic={}, client_id={}, clients={}", topic, clientId, clientCount());
        }
    }

    /**
     * Serialize a payload once and push it to every registered client.
     *
     * @param eventName SSE event name
     * @param payload payload, serialized with Jackson
     * @return number of clients the event was handed to
     */
    public int broadcast(String eventName, Object payload) {
        return broadcast(event(eventName, payload));
    }

    /**
     * Send a keep-alive comment to every client, which also flushes out dead connections.
     *
     * @return number of clients still registered
     */
    public int sendKeepAlive() {
        return broadcast(StreamEvent.keepAlive());
    }

    public int clientCount() {
        lock.lock();
        try {
            return clients.size();
        } finally {
            lock.unlock();
        }
    }

    public List<String> clientIds() {
        lock.lock();
        try {
            return List.copyOf(clients.keySet());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Close and remove every client.
     */
    public void closeAll() {
        List<StreamClient> snapshot;
        lock.lock();
        try {
            snapshot = new ArrayList<>(clients.values());
            clients.clear();
        } finally {
            lock.unlock();
        }
        snapshot.forEach(StreamClient::close);
    }

    private int broadcast(StreamEvent event) {
        List<StreamClient> failed = new ArrayList<>();
        int delivered = 0;
        lock.lock();
        try {
            for (StreamClient client : new ArrayList<>(clients.values())) {
                if (deliverLocked(client, event, failed)) {
                    delivered++;
                }
            }
        } finally {
            lock.unlock();
        }
        failed.forEach(StreamClient::close);
        return delivered;
    }

    private StreamEvent initialStateEvent(Supplier<StreamEvent> state) {
        try {
            return state.get();
        } catch (RuntimeException e) {
            log.warn("Failed to build initial state, greeting without it: topic={}, reason={}", topic, e.getMessage());
            return null;
        }
    }

    /**
     * Hand an event to a client while holding the lock. A failing client is removed and collected so the
     * caller can close it after releasing the lock.
     */
    private boolean deliverLocked(StreamClient client, StreamEvent event, List<StreamClient> failed) {
        try {
            client.send(event);
            return true;
        } catch (Exception e) {
            log.warn("Dropping stream client after failed send: topic={}, client_id={}, reason={}",
                    topic, client.getClientId(), e.getMessage());
            clients.remove(client.getClientId(), client);
            failed.add(client);
            return false;
        }
    }

    /**
     * Serialize a payload into an event for this topic.
     *
     * @param eventName SSE event name
     * @param payload payload
     * @return event
     * @throws IllegalArgumentException if Jackson cannot serialize the payload
     */
    public StreamEvent event(String eventName, Object payload) {
        try {
            return new StreamEvent(eventName, objectMapper.writeValueAsString(payload));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Stream payload is not serializable: topic=" + topic + ", event=" + eventName, e);
        }
    }
}
