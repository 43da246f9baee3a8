package com.titan.cargo.dto.out;

import com.titan.cargo.model.Booking;

public record BookingResponse(
        String message,
        Booking booking
) {}
