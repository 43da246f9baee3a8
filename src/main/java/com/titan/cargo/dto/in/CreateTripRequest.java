package com.titan.cargo.dto.in;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;

import java.util.Date;
import java.util.List;

public record CreateTripRequest(
        @NotBlank(message = "vehicleId is required")
        String vehicleId,

        @NotBlank(message = "driverId is required")
        String driverId,

        String coDriverId,

        @Valid
        Route route,

        List<String> bookings,

        String borderControlPermit,
        Double taxValuationPayment,
        String deliveryConfirmationReceipt
) {

    public record Route(
            String from,
            String to,
            Date departureTime,
            Date arrivalTime
    ) {}
}
