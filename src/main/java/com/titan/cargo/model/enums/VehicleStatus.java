package com.titan.cargo.model.enums;

import lombok.Getter;

/**
 * No transition table: any status may follow any other.
 */
@Getter
public enum VehicleStatus implements CodedEnum {
    OPERATING("operating"),
    MAINTENANCE("maintenance"),
    GROUNDED("grounded");

    private final String value;

    VehicleStatus(String value) {
        this.value = value;
    }
}
