package com.titan.cargo.dto.out;

import com.titan.cargo.model.Booking;
import com.titan.cargo.model.enums.BookingStatus;
import com.titan.cargo.model.enums.PaymentStatus;

import java.util.Date;

public record BookingWithClientDTO(
        String id,
        String airwayBill,
        UserRefDTO client,
        Booking.CargoDetails cargoDetails,
        Booking.Route route,
        BookingStatus status,
        double price,
        PaymentStatus paymentStatus,
        Date createdAt,
        Date updatedAt
) {}
