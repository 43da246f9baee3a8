package com.titan.cargo.config;

import com.titan.cargo.model.Vehicle;
import com.titan.cargo.model.enums.VehicleStatus;
import com.titan.cargo.model.enums.VehicleType;
import com.titan.cargo.repository.VehicleRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Date;
import java.util.List;

/**
 * Inserts a small demo fleet into an empty vehicles collection when {@code app.seed-demo-fleet} is on.
 */
@Component
@Order(1)
public class FleetDataLoader implements CommandLineRunner {

    private static final Logger logger = LoggerFactory.getLogger(FleetDataLoader.class);

    private final VehicleRepository vehicleRepository;
    private final boolean enabled;

    public FleetDataLoader(VehicleRepository vehicleRepository,
                           @Value("${app.seed-demo-fleet:false}") boolean enabled) {
        this.vehicleRepository = vehicleRepository;
        this.enabled = enabled;
    }

    @Override
    public void run(String... args) {
        if (!enabled || vehicleRepository.count() > 0) {
            return;
        }
        List<Vehicle> fleet = List.of(
                vehicle("TC-PL-001", VehicleType.PLANE, "Boeing 777F", 102_000.0, VehicleStatus.OPERATING, "JFK"),
                vehicle("TC-SH-001", VehicleType.SHIP, "Panamax", 65_000_000.0, VehicleStatus.OPERATING, "Port of LA"),
                vehicle("TC-TR-001", VehicleType.TRUCK, "Volvo FH16", 40_000.0, VehicleStatus.OPERATING, "Dallas"),
                vehicle("TC-RL-001", VehicleType.TRAIN, "EMD SD70", 3_000_000.0, VehicleStatus.MAINTENANCE, "Chicago")
        );
        vehicleRepository.saveAll(fleet);
        logger.info("Flotte de démonstration créée: {} véhicules", fleet.size());
    }

    private Vehicle vehicle(String code, VehicleType type, String model, double capacity,
                            VehicleStatus status, String location) {
        Vehicle vehicle = new Vehicle();
        vehicle.setVehicleId(code);
        vehicle.setType(type);
        vehicle.setModel(model);
        vehicle.setCapacity(capacity);
        vehicle.setStatus(status);
        vehicle.setCurrentLocation(location);
        vehicle.setCreatedAt(new Date());
        return vehicle;
    }
}
