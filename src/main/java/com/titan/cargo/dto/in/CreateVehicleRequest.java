package com.titan.cargo.dto.in;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

public record CreateVehicleRequest(
        @NotBlank(message = "vehicleId is required")
        String vehicleId,

        @NotBlank(message = "type is required")
        String type,

        String model,

        @PositiveOrZero(message = "capacity must not be negative")
        Double capacity,

        String currentLocation,
        String assignedDriver
) {}
