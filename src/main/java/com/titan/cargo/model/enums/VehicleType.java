package com.titan.cargo.model.enums;

import lombok.Getter;

@Getter
public enum VehicleType implements CodedEnum {
    PLANE("plane"),
    SHIP("ship"),
    TRAIN("train"),
    TRUCK("truck");

    private final String value;

    VehicleType(String value) {
        this.value = value;
    }
}
