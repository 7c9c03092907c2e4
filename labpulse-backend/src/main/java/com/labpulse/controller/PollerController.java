package com.labpulse.controller;

import com.labpulse.api.PollerStatusResponse;
import com.labpulse.model.CycleSummary;
import com.labpulse.poller.PollScheduler;
import com.labpulse.poller.PollerBusyException;
import com.labpulse.stream.BroadcastRegistries;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/poller")
public class PollerController {

    private final PollScheduler pollScheduler;
    private final BroadcastRegistries registries;

    public PollerController(PollScheduler pollScheduler, BroadcastRegistries registries) {
        this.pollScheduler = pollScheduler;
        this.registries = registries;
    }

    @GetMapping
    public ResponseEntity<PollerStatusResponse> status() {
        var config = pollScheduler.getConfig();
        return ResponseEntity.ok(PollerStatusResponse.builder()
                .active(pollScheduler.isActive())
                .cycleInFlight(pollScheduler.isCycleInFlight())
                .intervalMs(config.getInterval().toMillis())
                .fetchTimeoutMs(config.getFetchTimeout().toMillis())
                .skippedTicks(pollScheduler.getSkippedTicks())
                .metricsClients(registries.metrics().clientCount())
                .statusClients(registries.status().clientCount())
                .maintenanceClients(registries.maintenance().clientCount())
                .lastCycle(pollScheduler.getLastCycleSummary().orElse(null))
                .build());
    }

    /**
     * POST /v1/poller/run
     *
     * @return summary of the cycle run on the request thread
     */
    @PostMapping("/run")
    public ResponseEntity<CycleSummary> runNow() {
        return pollScheduler.runCycle()
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new PollerBusyException("A poll cycle is already in progress"));
    }
}
