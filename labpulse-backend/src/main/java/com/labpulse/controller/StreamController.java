package com.labpulse.controller;

import com.labpulse.stream.BroadcastRegistries;
import com.labpulse.stream.SseStreamClient;
import com.labpulse.stream.StreamBroadcastRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Server-sent event endpoints, one per topic.
 */
@RestController
@RequestMapping("/v1/stream")
public class StreamController {
    private static final Logger log = LoggerFactory.getLogger(StreamController.class);

    private final BroadcastRegistries registries;
    private final ExecutorService writerPool;
    private final ScheduledExecutorService keepAliveScheduler;
    private final ScheduledExecutorService writeWatchdog;
    private final int maxPendingEvents;
    private final long writeTimeoutMs;
    private final long keepAliveMs;
    private ScheduledFuture<?> keepAliveTask;

    public StreamController(
            BroadcastRegistries registries,
            @Qualifier("streamWriterPool") ExecutorService writerPool,
            @Qualifier("streamKeepAliveScheduler") ScheduledExecutorService keepAliveScheduler,
            @Qualifier("streamWriteWatchdog") ScheduledExecutorService writeWatchdog,
            @Value("${labpulse.stream.max-pending-events:256}") int maxPendingEvents,
            @Value("${labpulse.stream.keep-alive-ms:30000}") long keepAliveMs,
            @Value("${labpulse.stream.write-timeout-ms:10000}") long writeTimeoutMs
    ) {
        this.registries = registries;
        this.writerPool = writerPool;
        this.keepAliveScheduler = keepAliveScheduler;
        this.writeWatchdog = writeWatchdog;
        this.maxPendingEvents = maxPendingEvents;
        this.writeTimeoutMs = writeTimeoutMs;
        this.keepAliveMs = keepAliveMs;
    }

    @PostConstruct
    public void startKeepAlive() {
        keepAliveTask = keepAliveScheduler.scheduleAtFixedRate(this::sendKeepAlive, keepAliveMs, keepAliveMs, TimeUnit.MILLISECONDS);
    }

    @PreDestroy
    public void stopKeepAlive() {
        if (keepAliveTask != null) {
            keepAliveTask.cancel(false);
        }
    }

    /**
     * GET /v1/stream/{topic}
     *
     * @param topic one of {@code metrics}, {@code status}, {@code maintenance}
     * @param response servlet response, for proxy headers
     * @return event stream
     */
    @GetMapping(value = "/{topic}", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@PathVariable("topic") String topic, HttpServletResponse response) {
        StreamBroadcastRegistry registry = registries.get(topic);

        response.setHeader("Cache-Control", "no-cache");
        response.setHeader("X-Accel-Buffering", "no");

        String clientId = "client-" + UUID.randomUUID();
        SseEmitter emitter = new SseEmitter(0L);
        SseStreamClient client = new SseStreamClient(clientId, emitter, maxPendingEvents, writerPool,
                writeWatchdog, writeTimeoutMs);

        emitter.onCompletion(() -> registry.unregister(clientId));
        emitter.onTimeout(() -> registry.unregister(clientId));
        emitter.onError(e -> registry.unregister(clientId));

        if (!registry.register(client)) {
            log.warn("Stream client dropped during greeting: topic={}, client_id={}", topic, clientId);
        }
        return emitter;
    }

    void sendKeepAlive() {
        try {
            for (StreamBroadcastRegistry registry : registries.all()) {
                registry.sendKeepAlive();
            }
        } catch (RuntimeException e) {
            log.warn("Keep-alive round failed: reason={}", e.getMessage());
        }
    }
}
