package com.labpulse.poller;

import com.labpulse.crypto.CredentialCodec;
import com.labpulse.driver.ConfigurationException;
import com.labpulse.driver.Driver;
import com.labpulse.driver.DriverFactory;
import com.labpulse.driver.MissingCredentialsException;
import com.labpulse.events.MetricsEventBus;
import com.labpulse.model.Capability;
import com.labpulse.model.CycleSummary;
import com.labpulse.model.DriverCredentials;
import com.labpulse.model.Integration;
import com.labpulse.model.MetricPayload;
import com.labpulse.model.MetricValue;
import com.labpulse.model.PollOutcome;
import com.labpulse.model.PollResult;
import com.labpulse.persistence.IntegrationNotFoundException;
import com.labpulse.persistence.IntegrationRepository;
import com.labpulse.stream.BroadcastRegistries;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives poll cycles over all active integrations.
 *
 * <p>A cycle lists active integrations ordered by name and polls them one after another: decrypt
 * credentials, build the driver, enumerate capabilities, fetch each capability under a timeout, publish
 * the payload on the event bus, broadcast it on the {@code metrics} topic and write the outcome back.
 * Only one cycle runs at a time; a tick that finds a cycle in flight is skipped.
 */
@Component
public class PollScheduler {
    private static final Logger log = LoggerFactory.getLogger(PollScheduler.class);

    public static final String METRICS_EVENT = "metrics";

    private final IntegrationRepository integrationRepository;
    private final CredentialCodec credentialCodec;
    private final DriverFactory driverFactory;
    private final MetricsEventBus eventBus;
    private final BroadcastRegistries registries;
    private final List<PollCycleListener> cycleListeners;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;
    private final ExecutorService fetchExecutor;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean cycleInFlight = new AtomicBoolean(false);
    private final AtomicInteger skippedTicks = new AtomicInteger();

    private ScheduledFuture<?> scheduledTask;
    private volatile PollerConfig config = PollerConfig.defaults();
    private volatile CountDownLatch currentCycleLatch;
    private volatile AtomicBoolean currentCycleCancelled;
    private volatile Future<?> currentFetch;
    private volatile CycleSummary lastCycle;

    @Autowired
    public PollScheduler(
            IntegrationRepository integrationRepository,
            CredentialCodec credentialCodec,
            DriverFactory driverFactory,
            MetricsEventBus eventBus,
            BroadcastRegistries registries,
            List<PollCycleListener> cycleListeners,
            Clock clock
    ) {
        this(integrationRepository, credentialCodec, driverFactory, eventBus, registries, cycleListeners, clock,
                Executors.newSingleThreadScheduledExecutor(daemonThreads("poll-scheduler-")),
                Executors.newCachedThreadPool(daemonThreads("poll-fetch-")));
    }

    public PollScheduler(
            IntegrationRepository integrationRepository,
            CredentialCodec credentialCodec,
            DriverFactory driverFactory,
            MetricsEventBus eventBus,
            BroadcastRegistries registries,
            List<PollCycleListener> cycleListeners,
            Clock clock,
            ScheduledExecutorService scheduler,
            ExecutorService fetchExecutor
    ) {
        this.integrationRepository = Objects.requireNonNull(integrationRepository, "integrationRepository");
        this.credentialCodec = Objects.requireNonNull(credentialCodec, "credentialCodec");
        this.driverFactory = Objects.requireNonNull(driverFactory, "driverFactory");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus");
        this.registries = Objects.requireNonNull(registries, "registries");
        this.cycleListeners = cycleListeners != null ? List.copyOf(cycleListeners) : List.of();
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.fetchExecutor = Objects.requireNonNull(fetchExecutor, "fetchExecutor");
    }

    /**
     * Run one cycle now and then every {@code config.interval}. No-op while already active.
     *
     * @param newConfig poller configuration; null uses defaults
     */
    public synchronized void start(PollerConfig newConfig) {
        if (running.get()) {
            log.warn("Poller already running");
            return;
        }

        PollerConfig effective = (newConfig != null ? newConfig : PollerConfig.defaults()).normalized();
        this.config = effective;
        running.set(true);
        long intervalMs = effective.getInterval().toMillis();
        scheduledTask = scheduler.scheduleAtFixedRate(this::tick, 0, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Started poller: interval_ms={}, fetch_timeout_ms={}", intervalMs, effective.getFetchTimeout().toMillis());
    }

    /**
     * Cancel the timer and any in-flight fetch, waiting briefly for a running cycle to wind down.
     * Safe to call repeatedly.
     */
    public synchronized void stop() {
        if (!running.getAndSet(false)) {
            return;
        }

        if (scheduledTask != null) {
            scheduledTask.cancel(false);
            scheduledTask = null;
        }

        AtomicBoolean cancelled = currentCycleCancelled;
        if (cancelled != null) {
            cancelled.set(true);
        }
        Future<?> fetch = currentFetch;
        if (fetch != null) {
            fetch.cancel(true);
        }

        CountDownLatch latch = currentCycleLatch;
        if (latch != null) {
            try {
                latch.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for poll cycle to stop");
            }
        }

        log.info("Stopped poller");
    }

    public boolean isActive() {
        return running.get();
    }

    public boolean isCycleInFlight() {
        return cycleInFlight.get();
    }

    public PollerConfig getConfig() {
        return config;
    }

    public int getSkippedTicks() {
        return skippedTicks.get();
    }

    public Optional<CycleSummary> getLastCycleSummary() {
        return Optional.ofNullable(lastCycle);
    }

    /**
     * Run one cycle on the calling thread.
     *
     * @return the summary, or empty when another cycle was already in flight
     */
    public Optional<CycleSummary> runCycle() {
        if (!cycleInFlight.compareAndSet(false, true)) {
            skippedTicks.incrementAndGet();
            log.warn("Skipping poll cycle: previous cycle still running");
            return Optional.empty();
        }

        CountDownLatch latch = new CountDownLatch(1);
        AtomicBoolean cancelled = new AtomicBoolean(false);
        currentCycleLatch = latch;
        currentCycleCancelled = cancelled;
        try {
            CycleSummary summary = executeCycle(cancelled);
            lastCycle = summary;
            notifyListeners(summary);
            return Optional.of(summary);
        } finally {
            currentCycleCancelled = null;
            latch.countDown();
            cycleInFlight.set(false);
        }
    }

    /**
     * Poll a single integration outside the schedule.
     *
     * @param integrationId integration id
     * @param force ignore the integration's poll interval
     * @return poll result
     * @throws IntegrationNotFoundException if the id does not exist
     * @throws IntegrationInactiveException if the integration is switched off, even when forced
     * @throws PollRateLimitedException if polled again before its interval elapsed and not forced
     * @throws PollerBusyException if a cycle is in flight
     */
    public PollResult pollNow(long integrationId, boolean force) {
        Integration integration = integrationRepository.findById(integrationId)
                .orElseThrow(() -> new IntegrationNotFoundException(integrationId));
        if (!integration.isActive()) {
            throw new IntegrationInactiveException(integrationId);
        }

        if (!force && integration.getLastPollAt() != null && integration.getPollIntervalMs() != null) {
            Instant next = integration.getLastPollAt().plusMillis(integration.getPollIntervalMs());
            Instant now = clock.instant();
            if (now.isBefore(next)) {
                long waitSec = (Duration.between(now, next).toMillis() + 999) / 1000;
                throw new PollRateLimitedException(integrationId, waitSec);
            }
        }

        if (!cycleInFlight.compareAndSet(false, true)) {
            throw new PollerBusyException("A poll cycle is in progress");
        }
        try {
            return pollIntegration(integration, new AtomicBoolean(false));
        } finally {
            cycleInFlight.set(false);
        }
    }

    @PreDestroy
    public void shutdown() {
        stop();
        scheduler.shutdownNow();
        fetchExecutor.shutdownNow();
    }

    private void tick() {
        try {
            runCycle();
        } catch (Throwable t) {
            // Any throwable escaping a fixed-rate task would cancel all future ticks.
            log.error("Poll cycle failed", t);
        }
    }

    private CycleSummary executeCycle(AtomicBoolean cancelled) {
        Instant startedAt = clock.instant();
        List<PollResult> results = new ArrayList<>();
        List<Integration> integrations = integrationRepository.listActiveIntegrations();

        if (integrations.isEmpty()) {
            log.debug("No active integrations to poll");
        } else {
            log.info("Polling {} integrations", integrations.size());
        }

        for (Integration integration : integrations) {
            if (cancelled.get()) {
                log.info("Poll cycle cancelled: polled={}, remaining={}", results.size(), integrations.size() - results.size());
                break;
            }
            if (!integration.isActive()) {
                continue;
            }
            results.add(pollIntegration(integration, cancelled));
        }

        Instant finishedAt = clock.instant();
        log.info("Poll cycle complete: integrations={}, duration_ms={}",
                results.size(), Duration.between(startedAt, finishedAt).toMillis());
        return CycleSummary.builder()
                .startedAt(startedAt)
                .finishedAt(finishedAt)
                .results(List.copyOf(results))
                .build();
    }

    private PollResult pollIntegration(Integration integration, AtomicBoolean cancelled) {
        String name = integration.getServiceName();
        try {
            Driver driver;
            try {
                if (!integration.hasCredentials()) {
                    throw new MissingCredentialsException("No credentials configured");
                }
                DriverCredentials credentials = credentialCodec.decrypt(integration.getCredentials());
                driver = driverFactory.create(integration.getId(), integration.getServiceType(), credentials);
            } catch (ConfigurationException e) {
                log.warn("Skipping integration: integration_id={}, name={}, reason={}", integration.getId(), name, e.getMessage());
                return recordSkip(integration, e.getMessage());
            }

            List<Capability> capabilities = driver.getCapabilities();
            Map<String, Object> data = new LinkedHashMap<>();
            int successCount = 0;
            int failCount = 0;

            for (Capability capability : capabilities) {
                if (cancelled.get()) {
                    break;
                }
                String key = capability.getKey();
                try {
                    Optional<MetricValue> value = fetchWithTimeout(driver, key, cancelled);
                    if (value.isPresent()) {
                        data.put(key, value.get().getValue());
                        successCount++;
                    }
                } catch (TimeoutException e) {
                    failCount++;
                    log.warn("Capability fetch timed out: integration_id={}, name={}, key={}, timeout_ms={}",
                            integration.getId(), name, key, config.getFetchTimeout().toMillis());
                } catch (CancellationException e) {
                    failCount++;
                    log.info("Capability fetch cancelled: integration_id={}, name={}, key={}", integration.getId(), name, key);
                } catch (ExecutionException e) {
                    failCount++;
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    log.warn("Capability fetch failed: integration_id={}, name={}, key={}, reason={}",
                            integration.getId(), name, key, cause.getMessage());
                }
            }

            MetricPayload payload = MetricPayload.builder()
                    .integrationId(integration.getId())
                    .integrationName(name)
                    .integrationType(integration.getServiceType())
                    .timestamp(clock.instant())
                    .data(data)
                    .build();
            eventBus.publish(payload);
            registries.metrics().broadcast(METRICS_EVENT, payload);

            PollOutcome outcome = successCount > 0 ? PollOutcome.SUCCESS : PollOutcome.FAILED;
            log.info("Published metrics: integration_id={}, name={}, success={}, failed={}",
                    integration.getId(), name, successCount, failCount);
            persistOutcome(integration, outcome);
            return PollResult.builder()
                    .integrationId(integration.getId())
                    .integrationName(name)
                    .successCount(successCount)
                    .failCount(failCount)
                    .outcome(outcome)
                    .build();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while polling integration: integration_id={}, name={}", integration.getId(), name);
            return recordSkip(integration, "interrupted");
        } catch (RuntimeException e) {
            log.error("Failed to poll integration: integration_id={}, name={}", integration.getId(), name, e);
            return recordSkip(integration, e.getMessage());
        }
    }

    private Optional<MetricValue> fetchWithTimeout(Driver driver, String key, AtomicBoolean cancelled)
            throws InterruptedException, ExecutionException, TimeoutException {
        Future<Optional<MetricValue>> future = fetchExecutor.submit(() -> driver.fetchMetric(key));
        currentFetch = future;
        // stop() sets the flag before reading currentFetch, so one of the two sides cancels the fetch.
        if (cancelled.get()) {
            future.cancel(true);
        }
        try {
            Optional<MetricValue> value = future.get(config.getFetchTimeout().toMillis(), TimeUnit.MILLISECONDS);
            return value != null ? value : Optional.empty();
        } catch (TimeoutException | InterruptedException e) {
            future.cancel(true);
            throw e;
        } finally {
            currentFetch = null;
        }
    }

    private PollResult recordSkip(Integration integration, String reason) {
        persistOutcome(integration, PollOutcome.FAILED);
        return PollResult.builder()
                .integrationId(integration.getId())
                .integrationName(integration.getServiceName())
                .successCount(0)
                .failCount(0)
                .outcome(PollOutcome.FAILED)
                .skipReason(reason)
                .build();
    }

    private void persistOutcome(Integration integration, PollOutcome outcome) {
        try {
            integrationRepository.updateLastPoll(integration.getId(), outcome, clock.instant());
        } catch (RuntimeException e) {
            log.error("Failed to record poll outcome: integration_id={}, outcome={}", integration.getId(), outcome.wireName(), e);
        }
    }

    private void notifyListeners(CycleSummary summary) {
        for (PollCycleListener listener : cycleListeners) {
            try {
                listener.onCycleComplete(summary);
            } catch (Exception e) {
                log.error("Poll cycle listener failed: listener={}", listener.getClass().getSimpleName(), e);
            }
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
