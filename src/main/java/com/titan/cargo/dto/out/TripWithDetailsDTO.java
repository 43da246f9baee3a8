package com.titan.cargo.dto.out;

import com.titan.cargo.model.Booking;
import com.titan.cargo.model.Trip;
import com.titan.cargo.model.Vehicle;
import com.titan.cargo.model.enums.TripStatus;

import java.util.Date;
import java.util.List;

public record TripWithDetailsDTO(
        String id,
        String tripId,
        Vehicle vehicle,
        UserRefDTO driver,
        UserRefDTO coDriver,
        List<Booking> bookings,
        Trip.Route route,
        Double fuelUsed,
        Double distance,
        TripStatus status,
        String borderControlPermit,
        Double taxValuationPayment,
        String deliveryConfirmationReceipt,
        Date createdAt,
        Date updatedAt
) {}
