package com.titan.cargo.dto.out;

import com.titan.cargo.model.Vehicle;

public record VehicleResponse(
        String message,
        Vehicle vehicle
) {}
