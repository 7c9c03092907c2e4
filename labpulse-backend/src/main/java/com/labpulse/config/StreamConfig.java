package com.labpulse.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.labpulse.stream.BroadcastRegistries;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Streaming registries and the threads that write to stream clients.
 */
@Configuration
public class StreamConfig {

    @Bean(destroyMethod = "closeAll")
    public BroadcastRegistries broadcastRegistries(ObjectMapper objectMapper) {
        return new BroadcastRegistries(objectMapper);
    }

    /**
     * Writer pool that keeps {@code writer-threads} warm and grows up to {@code writer-max-threads}, so a
     * client stuck in a write until its deadline only holds its own thread.
     */
    @Bean(name = "streamWriterPool", destroyMethod = "shutdownNow")
    public ExecutorService streamWriterPool(
            @Value("${labpulse.stream.writer-threads:4}") int writerThreads,
            @Value("${labpulse.stream.writer-max-threads:64}") int writerMaxThreads
    ) {
        int core = Math.max(1, writerThreads);
        return new ThreadPoolExecutor(core, Math.max(core, writerMaxThreads), 60L, TimeUnit.SECONDS,
                new SynchronousQueue<>(), namedDaemonThreads("stream-writer-"));
    }

    @Bean(name = "streamWriteWatchdog", destroyMethod = "shutdownNow")
    public ScheduledExecutorService streamWriteWatchdog() {
        ScheduledThreadPoolExecutor watchdog = new ScheduledThreadPoolExecutor(1, namedDaemonThreads("stream-watchdog-"));
        watchdog.setRemoveOnCancelPolicy(true);
        return watchdog;
    }

    @Bean(name = "streamKeepAliveScheduler", destroyMethod = "shutdownNow")
    public ScheduledExecutorService streamKeepAliveScheduler() {
        return Executors.newSingleThreadScheduledExecutor(namedDaemonThreads("stream-keepalive-"));
    }

    static ThreadFactory namedDaemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
