package com.titan.cargo.dto.in;

public record UpdateTripStatusRequest(
        String status,
        Double fuelUsed,
        Double distance
) {}
