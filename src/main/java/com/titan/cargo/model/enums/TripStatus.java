package com.titan.cargo.model.enums;

import lombok.Getter;

@Getter
public enum TripStatus implements CodedEnum {
    SCHEDULED("scheduled"),
    IN_PROGRESS("in-progress"),
    COMPLETED("completed"),
    CANCELLED("cancelled");

    private final String value;

    TripStatus(String value) {
        this.value = value;
    }
}
