package com.titan.cargo.repository;

import com.titan.cargo.model.Trip;
import com.titan.cargo.model.enums.TripStatus;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface TripRepository extends MongoRepository<Trip, String> {

    List<Trip> findAllByOrderByCreatedAtDesc();

    List<Trip> findByStatus(TripStatus status);
}
