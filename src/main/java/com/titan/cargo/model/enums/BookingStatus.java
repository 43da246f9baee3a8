package com.titan.cargo.model.enums;

import lombok.Getter;

@Getter
public enum BookingStatus implements CodedEnum {
    PENDING("pending"),
    CONFIRMED("confirmed"),
    IN_TRANSIT("in-transit"),
    DELIVERED("delivered"),
    CANCELLED("cancelled");

    private final String value;

    BookingStatus(String value) {
        this.value = value;
    }
}
