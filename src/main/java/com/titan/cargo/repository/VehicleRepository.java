package com.titan.cargo.repository;

import com.titan.cargo.model.Vehicle;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface VehicleRepository extends MongoRepository<Vehicle, String> {

    List<Vehicle> findAllByOrderByCreatedAtDesc();

    boolean existsByVehicleId(String vehicleId);
}
