package com.labpulse.api;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class MaintenanceRequest {
    @NotNull(message = "enabled is required")
    private Boolean enabled;
}
