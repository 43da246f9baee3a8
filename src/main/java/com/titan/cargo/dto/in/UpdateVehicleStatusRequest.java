package com.titan.cargo.dto.in;

public record UpdateVehicleStatusRequest(
        String status,
        String currentLocation
) {}
