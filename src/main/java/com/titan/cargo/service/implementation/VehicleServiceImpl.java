package com.titan.cargo.service.implementation;

import com.titan.cargo.dto.in.CreateVehicleRequest;
import com.titan.cargo.dto.in.UpdateVehicleStatusRequest;
import com.titan.cargo.dto.out.VehicleWithDriverDTO;
import com.titan.cargo.exception.BadRequestException;
import com.titan.cargo.exception.ResourceNotFoundException;
import com.titan.cargo.model.Vehicle;
import com.titan.cargo.model.enums.CodedEnum;
import com.titan.cargo.model.enums.VehicleStatus;
import com.titan.cargo.model.enums.VehicleType;
import com.titan.cargo.repository.VehicleRepository;
import com.titan.cargo.service.VehicleService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.util.Date;
import java.util.List;

@Service
public class VehicleServiceImpl implements VehicleService {

    private static final Logger logger = LoggerFactory.getLogger(VehicleServiceImpl.class);

    private final VehicleRepository vehicleRepository;
    private final ReferenceResolver referenceResolver;

    public VehicleServiceImpl(VehicleRepository vehicleRepository, ReferenceResolver referenceResolver) {
        this.vehicleRepository = vehicleRepository;
        this.referenceResolver = referenceResolver;
    }

    @Override
    public Vehicle createVehicle(CreateVehicleRequest dto) {
        VehicleType type = CodedEnum.parse(VehicleType.class, dto.type(), "type");
        if (vehicleRepository.existsByVehicleId(dto.vehicleId())) {
            throw new BadRequestException("Vehicle already exists: " + dto.vehicleId());
        }

        Vehicle vehicle = new Vehicle();
        vehicle.setVehicleId(dto.vehicleId());
        vehicle.setType(type);
        vehicle.setModel(dto.model());
        vehicle.setCapacity(dto.capacity());
        vehicle.setCurrentLocation(dto.currentLocation());
        vehicle.setAssignedDriver(dto.assignedDriver());
        vehicle.setStatus(VehicleStatus.OPERATING);
        vehicle.setCreatedAt(new Date());

        try {
            Vehicle saved = vehicleRepository.save(vehicle);
            logger.info("Véhicule ajouté à la flotte: {} ({})", saved.getVehicleId(), type.getValue());
            return saved;
        } catch (DuplicateKeyException e) {
            throw new BadRequestException("Vehicle already exists: " + dto.vehicleId());
        }
    }

    @Override
    public List<VehicleWithDriverDTO> getVehicles() {
        return referenceResolver.vehiclesWithDrivers(vehicleRepository.findAllByOrderByCreatedAtDesc());
    }

    @Override
    public Vehicle findById(String id) {
        return vehicleRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Vehicle not found"));
    }

    @Override
    public Vehicle updateStatus(String id, UpdateVehicleStatusRequest request) {
        Vehicle vehicle = findById(id);
        VehicleStatus newStatus = CodedEnum.parse(VehicleStatus.class, request.status(), "status");
        vehicle.setStatus(newStatus);
        if (request.currentLocation() != null) {
            vehicle.setCurrentLocation(request.currentLocation());
        }
        Vehicle saved = vehicleRepository.save(vehicle);
        logger.info("Statut du véhicule {} mis à jour: {}", vehicle.getVehicleId(), newStatus.getValue());
        return saved;
    }
}
