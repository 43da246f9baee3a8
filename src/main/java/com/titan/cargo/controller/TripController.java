package com.titan.cargo.controller;

import com.titan.cargo.dto.in.CreateTripRequest;
import com.titan.cargo.dto.in.UpdateTripStatusRequest;
import com.titan.cargo.dto.out.TripResponse;
import com.titan.cargo.dto.out.TripWithDetailsDTO;
import com.titan.cargo.model.Trip;
import com.titan.cargo.service.TripService;
import io.swagger.v3.oas.annotations.Operation;
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
@RequestMapping("/api/trips")
@Tag(name = "Trajets", description = "Planification et suivi des trajets.")
public class TripController {

    private final TripService tripService;

    public TripController(TripService tripService) {
        this.tripService = tripService;
    }

    @Operation(summary = "Créer un trajet")
    @PostMapping
    public ResponseEntity<TripResponse> createTrip(@Valid @RequestBody CreateTripRequest request) {
        Trip trip = tripService.createTrip(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(new TripResponse("Trip created successfully", trip));
    }

    @Operation(summary = "Lister les trajets", description = "Véhicule, chauffeurs et réservations résolus, plus récents d'abord.")
    @GetMapping
    public ResponseEntity<List<TripWithDetailsDTO>> getTrips() {
        return ResponseEntity.ok(tripService.getTrips());
    }

    @Operation(summary = "Changer le statut d'un trajet")
    @PutMapping("/{id}/status")
    public ResponseEntity<TripResponse> updateStatus(@PathVariable String id,
                                                     @RequestBody UpdateTripStatusRequest request) {
        Trip trip = tripService.updateStatus(id, request);
        return ResponseEntity.ok(new TripResponse("Trip updated successfully", trip));
    }
}
