package com.titan.cargo.dto.out;

import com.titan.cargo.model.enums.VehicleStatus;
import com.titan.cargo.model.enums.VehicleType;

import java.util.Date;

public record VehicleWithDriverDTO(
        String id,
        String vehicleId,
        VehicleType type,
        String model,
        Double capacity,
        VehicleStatus status,
        String currentLocation,
        UserRefDTO assignedDriver,
        Date createdAt
) {}
