package com.titan.cargo.service;

import com.titan.cargo.dto.in.CreateVehicleRequest;
import com.titan.cargo.dto.in.UpdateVehicleStatusRequest;
import com.titan.cargo.dto.out.VehicleWithDriverDTO;
import com.titan.cargo.model.Vehicle;

import java.util.List;

public interface VehicleService {
    Vehicle createVehicle(CreateVehicleRequest request);
    List<VehicleWithDriverDTO> getVehicles();
    Vehicle findById(String id);
    Vehicle updateStatus(String id, UpdateVehicleStatusRequest request);
}
