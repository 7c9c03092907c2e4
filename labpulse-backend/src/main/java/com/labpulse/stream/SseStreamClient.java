package com.labpulse.stream;

import org.springframework.http.MediaType;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;

/**
 * {@link BufferedStreamClient} writing to a Spring MVC {@link SseEmitter}.
 */
public class SseStreamClient extends BufferedStreamClient {

    private final SseEmitter emitter;

    public SseStreamClient(String clientId, SseEmitter emitter, int maxPendingEvents, Executor writerPool) {
        this(clientId, emitter, maxPendingEvents, writerPool, null, 0);
    }

    public SseStreamClient(String clientId, SseEmitter emitter, int maxPendingEvents, Executor writerPool,
                           ScheduledExecutorService writeWatchdog, long writeTimeoutMs) {
        super(clientId, maxPendingEvents, writerPool, writeWatchdog, writeTimeoutMs);
        this.emitter = emitter;
    }

    public SseEmitter getEmitter() {
        return emitter;
    }

    @Override
    protected void write(StreamEvent event) throws IOException {
        if (event.isComment()) {
            emitter.send(SseEmitter.event().comment(event.data()));
            return;
        }
        emitter.send(SseEmitter.event().name(event.name()).data(event.data(), MediaType.APPLICATION_JSON));
    }

    @Override
    protected void closeTransport() {
        emitter.complete();
    }
}
