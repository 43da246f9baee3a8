package com.titan.cargo.dto.in;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;

import java.util.Date;

public record CreateBookingRequest(
        @Valid
        @NotNull(message = "cargoDetails is required")
        CargoDetails cargoDetails,

        @Valid
        @NotNull(message = "route is required")
        Route route,

        @NotNull(message = "price is required")
        @PositiveOrZero(message = "price must not be negative")
        Double price
) {

    public record CargoDetails(
            @NotBlank(message = "cargoDetails.description is required")
            String description,

            @NotNull(message = "cargoDetails.weight is required")
            @Positive(message = "cargoDetails.weight must be positive")
            Double weight,

            Dimensions dimensions,

            // general when absent
            String type
    ) {}

    public record Dimensions(
            Double length,
            Double width,
            Double height
    ) {}

    public record Route(
            @NotBlank(message = "route.from is required")
            String from,

            @NotBlank(message = "route.to is required")
            String to,

            @NotNull(message = "route.departureDate is required")
            Date departureDate,

            @NotNull(message = "route.arrivalDate is required")
            Date arrivalDate
    ) {}
}
