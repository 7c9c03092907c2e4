package com.labpulse.controller;

import com.labpulse.api.MaintenanceRequest;
import com.labpulse.api.MaintenanceResponse;
import com.labpulse.maintenance.MaintenanceStateChannel;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/settings")
public class SettingsController {

    private final MaintenanceStateChannel maintenance;

    public SettingsController(MaintenanceStateChannel maintenance) {
        this.maintenance = maintenance;
    }

    @GetMapping("/maintenance")
    public ResponseEntity<MaintenanceResponse> getMaintenance() {
        return ResponseEntity.ok(new MaintenanceResponse(maintenance.isEnabled()));
    }

    @PatchMapping("/maintenance")
    public ResponseEntity<MaintenanceResponse> setMaintenance(@Valid @RequestBody MaintenanceRequest request) {
        maintenance.setEnabled(request.getEnabled());
        return ResponseEntity.ok(new MaintenanceResponse(maintenance.isEnabled()));
    }
}
