package com.titan.cargo.controller;

import com.titan.cargo.dto.in.CreateVehicleRequest;
import com.titan.cargo.dto.in.UpdateVehicleStatusRequest;
import com.titan.cargo.dto.out.VehicleResponse;
import com.titan.cargo.dto.out.VehicleWithDriverDTO;
import com.titan.cargo.model.Vehicle;
import com.titan.cargo.service.VehicleService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/vehicles")
@Tag(name = "Flotte", description = "Véhicules de la flotte et leur état.")
public class VehicleController {

    private final VehicleService vehicleService;

    public VehicleController(VehicleService vehicleService) {
        this.vehicleService = vehicleService;
    }

    @Operation(summary = "Ajouter un véhicule", description = "Réservé aux utilisateurs de rôle ADMIN.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Véhicule créé"),
            @ApiResponse(responseCode = "400", description = "Code flotte déjà utilisé ou type inconnu"),
            @ApiResponse(responseCode = "403", description = "L'utilisateur n'a pas le rôle ADMIN")
    })
    @PostMapping
    public ResponseEntity<VehicleResponse> createVehicle(@Valid @RequestBody CreateVehicleRequest request) {
        Vehicle vehicle = vehicleService.createVehicle(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(new VehicleResponse("Vehicle created successfully", vehicle));
    }

    @Operation(summary = "Lister les véhicules")
    @GetMapping
    public ResponseEntity<List<VehicleWithDriverDTO>> getVehicles() {
        return ResponseEntity.ok(vehicleService.getVehicles());
    }

    @Operation(summary = "Changer le statut d'un véhicule", description = "Aucune restriction de transition.")
    @PutMapping("/{id}/status")
    public ResponseEntity<VehicleResponse> updateStatus(@PathVariable String id,
                                                        @RequestBody UpdateVehicleStatusRequest request) {
        Vehicle vehicle = vehicleService.updateStatus(id, request);
        return ResponseEntity.ok(new VehicleResponse("Vehicle status updated", vehicle));
    }
}
