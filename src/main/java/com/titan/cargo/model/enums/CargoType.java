package com.titan.cargo.model.enums;

import lombok.Getter;

@Getter
public enum CargoType implements CodedEnum {
    GENERAL("general"),
    HAZARDOUS("hazardous"),
    PERISHABLE("perishable"),
    VALUABLE("valuable");

    private final String value;

    CargoType(String value) {
        this.value = value;
    }
}
