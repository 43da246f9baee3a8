package com.titan.cargo.dto.out;

import com.titan.cargo.model.Trip;

public record TripResponse(
        String message,
        Trip trip
) {}
