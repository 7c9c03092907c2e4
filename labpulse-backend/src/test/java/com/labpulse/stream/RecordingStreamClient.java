package com.labpulse.stream;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Stream client that records events in memory and can be told to fail.
 */
public class RecordingStreamClient implements StreamClient {

    private final String clientId;
    private final List<StreamEvent> events = new ArrayList<>();
    private volatile boolean failing;
    private volatile boolean closed;
    private int sendAttempts;

    public RecordingStreamClient(String clientId) {
        this.clientId = clientId;
    }

    public void failNextSends() {
        failing = true;
    }

    @Override
    public String getClientId() {
        return clientId;
    }

    @Override
    public synchronized void send(StreamEvent event) throws IOException {
        sendAttempts++;
        if (failing || closed) {
            throw new IOException("broken pipe");
        }
        events.add(event);
    }

    @Override
    public void close() {
        closed = true;
    }

    public boolean isClosed() {
        return closed;
    }

    public synchronized int getSendAttempts() {
        return sendAttempts;
    }

    public synchronized List<StreamEvent> getEvents() {
        return new ArrayList<>(events);
    }

    public synchronized List<StreamEvent> eventsNamed(String name) {
        return events.stream().filter(e -> name.equals(e.name())).collect(Collectors.toList());
    }
}
