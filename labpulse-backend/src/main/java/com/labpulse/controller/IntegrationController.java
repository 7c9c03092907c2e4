package com.labpulse.controller;

import com.labpulse.api.ConnectionTestResponse;
import com.labpulse.api.ErrorResponse;
import com.labpulse.api.MonitorListResponse;
import com.labpulse.crypto.CredentialCodec;
import com.labpulse.driver.Driver;
import com.labpulse.driver.DriverFactory;
import com.labpulse.driver.MissingCredentialsException;
import com.labpulse.driver.MonitorListing;
import com.labpulse.events.LatestMetricsCache;
import com.labpulse.model.ConnectionTestResult;
import com.labpulse.model.Integration;
import com.labpulse.model.PollResult;
import com.labpulse.persistence.IntegrationNotFoundException;
import com.labpulse.persistence.IntegrationRepository;
import com.labpulse.poller.PollScheduler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Per-integration read paths and on-demand actions.
 */
@Slf4j
@RestController
@RequestMapping("/v1/integrations")
public class IntegrationController {

    private final IntegrationRepository integrationRepository;
    private final CredentialCodec credentialCodec;
    private final DriverFactory driverFactory;
    private final LatestMetricsCache metricsCache;
    private final PollScheduler pollScheduler;

    public IntegrationController(
            IntegrationRepository integrationRepository,
            CredentialCodec credentialCodec,
            DriverFactory driverFactory,
            LatestMetricsCache metricsCache,
            PollScheduler pollScheduler
    ) {
        this.integrationRepository = integrationRepository;
        this.credentialCodec = credentialCodec;
        this.driverFactory = driverFactory;
        this.metricsCache = metricsCache;
        this.pollScheduler = pollScheduler;
    }

    /**
     * GET /v1/integrations/{id}/monitors
     *
     * @param id integration id
     * @return monitors the integration currently reports
     */
    @GetMapping("/{id}/monitors")
    public ResponseEntity<MonitorListResponse> listMonitors(@PathVariable("id") long id) {
        Integration integration = load(id);
        Driver driver = buildDriver(integration);
        if (!(driver instanceof MonitorListing listing)) {
            throw new IllegalArgumentException("Service type does not support monitor listing: " + integration.getServiceType());
        }

        var monitors = listing.fetchMonitorList();
        log.info("Listed monitors: integration_id={}, monitors={}", id, monitors.size());
        return ResponseEntity.ok(MonitorListResponse.builder()
                .integrationId(id)
                .integrationName(integration.getServiceName())
                .serviceType(integration.getServiceType())
                .monitors(monitors)
                .build());
    }

    /**
     * GET /v1/integrations/{id}/metrics
     *
     * @param id integration id
     * @return the last payload published for the integration
     */
    @GetMapping("/{id}/metrics")
    public ResponseEntity<?> latestMetrics(@PathVariable("id") long id) {
        load(id);
        var payload = metricsCache.get(id);
        if (payload.isEmpty()) {
            return ResponseEntity.status(404).body(ErrorResponse.of(
                    "NO_METRICS_YET", "Integration has not been polled since startup", null));
        }
        return ResponseEntity.ok(payload.get());
    }

    /**
     * POST /v1/integrations/{id}/test
     *
     * @param id integration id
     * @return connection test outcome
     */
    @PostMapping("/{id}/test")
    public ResponseEntity<ConnectionTestResponse> testConnection(@PathVariable("id") long id) {
        Integration integration = load(id);
        ConnectionTestResult result = buildDriver(integration).testConnection();
        log.info("Connection test: integration_id={}, success={}", id, result.isSuccess());
        return ResponseEntity.ok(ConnectionTestResponse.builder()
                .integrationId(id)
                .success(result.isSuccess())
                .message(result.getMessage())
                .build());
    }

    /**
     * POST /v1/integrations/{id}/poll
     *
     * @param id integration id
     * @param force ignore the integration's poll interval
     * @return poll result
     */
    @PostMapping("/{id}/poll")
    public ResponseEntity<PollResult> pollNow(
            @PathVariable("id") long id,
            @RequestParam(value = "force", defaultValue = "false") boolean force
    ) {
        return ResponseEntity.ok(pollScheduler.pollNow(id, force));
    }

    private Integration load(long id) {
        return integrationRepository.findById(id).orElseThrow(() -> new IntegrationNotFoundException(id));
    }

    private Driver buildDriver(Integration integration) {
        if (!integration.hasCredentials()) {
            throw new MissingCredentialsException("No credentials configured");
        }
        return driverFactory.create(integration.getId(), integration.getServiceType(),
                credentialCodec.decrypt(integration.getCredentials()));
    }
}
