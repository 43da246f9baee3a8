package com.titan.cargo.repository;

import com.titan.cargo.model.Booking;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface BookingRepository extends MongoRepository<Booking, String> {

    List<Booking> findAllByOrderByCreatedAtDesc();

    List<Booking> findByClientIdOrderByCreatedAtDesc(String clientId);

    List<Booking> findTop10ByOrderByCreatedAtDesc();
}
