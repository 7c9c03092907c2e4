package com.labpulse.controller;

import com.labpulse.model.ItemStatus;
import com.labpulse.status.StatusTracker;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/v1/status")
public class StatusController {

    private final StatusTracker statusTracker;

    public StatusController(StatusTracker statusTracker) {
        this.statusTracker = statusTracker;
    }

    /**
     * GET /v1/status
     *
     * @return Service status
     */
    @GetMapping
    public ResponseEntity<Map<String, String>> getStatus() {
        return ResponseEntity.ok(Map.of("status", "UP"));
    }

    /**
     * GET /v1/status/cards
     *
     * @return current status of every status card
     */
    @GetMapping("/cards")
    public ResponseEntity<Map<Long, ItemStatus>> getCardStatuses() {
        return ResponseEntity.ok(statusTracker.currentStatuses());
    }
}
