package com.labpulse.stream;

import java.io.IOException;

/**
 * A connected streaming client as seen by a {@link StreamBroadcastRegistry}.
 */
public interface StreamClient {

    String getClientId();

    /**
     * Hand an event to the client without blocking on the network.
     *
     * @param event event
     * @throws IOException if the client is gone or cannot accept more events; the registry drops it
     */
    void send(StreamEvent event) throws IOException;

    /**
     * Release the transport. Safe to call more than once.
     */
    void close();
}
