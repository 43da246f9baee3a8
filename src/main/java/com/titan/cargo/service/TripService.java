package com.titan.cargo.service;

import com.titan.cargo.dto.in.CreateTripRequest;
import com.titan.cargo.dto.in.UpdateTripStatusRequest;
import com.titan.cargo.dto.out.TripWithDetailsDTO;
import com.titan.cargo.model.Trip;

import java.util.List;

public interface TripService {
    Trip createTrip(CreateTripRequest request);
    List<TripWithDetailsDTO> getTrips();
    Trip updateStatus(String tripId, UpdateTripStatusRequest request);
}
