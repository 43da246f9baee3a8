package com.titan.cargo.model;

import com.titan.cargo.model.enums.VehicleStatus;
import com.titan.cargo.model.enums.VehicleType;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.util.Date;

@Document(collection = "vehicles")
@Data
@NoArgsConstructor
public class Vehicle {

    @Id
    private String id;

    // Fleet code, e.g. "TC-PL-001".
    @Indexed(unique = true)
    private String vehicleId;

    private VehicleType type;
    private String model;
    private Double capacity;
    private VehicleStatus status = VehicleStatus.OPERATING;
    private String currentLocation;
    private String assignedDriver;
    private Date createdAt;
}
