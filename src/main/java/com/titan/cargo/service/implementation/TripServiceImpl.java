package com.titan.cargo.service.implementation;

import com.titan.cargo.dto.in.CreateTripRequest;
import com.titan.cargo.dto.in.UpdateTripStatusRequest;
import com.titan.cargo.dto.out.TripWithDetailsDTO;
import com.titan.cargo.exception.ApiException;
import com.titan.cargo.exception.BadRequestException;
import com.titan.cargo.exception.DanglingReferenceException;
import com.titan.cargo.exception.ResourceNotFoundException;
import com.titan.cargo.model.Trip;
import com.titan.cargo.model.enums.CodedEnum;
import com.titan.cargo.model.enums.TripStatus;
import com.titan.cargo.repository.BookingRepository;
import com.titan.cargo.repository.TripRepository;
import com.titan.cargo.repository.UserRepository;
import com.titan.cargo.repository.VehicleRepository;
import com.titan.cargo.service.TripService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Date;
import java.util.List;

@Service
public class TripServiceImpl implements TripService {

    private static final Logger logger = LoggerFactory.getLogger(TripServiceImpl.class);

    static final String TRIP_ID_PREFIX = "FLT-";
    private static final int MAX_TRIP_ID_ATTEMPTS = 3;

    private final TripRepository tripRepository;
    private final VehicleRepository vehicleRepository;
    private final UserRepository userRepository;
    private final BookingRepository bookingRepository;
    private final ReferenceResolver referenceResolver;
    private final boolean strictReferences;
    private final boolean enforceRouteOrder;

    public TripServiceImpl(TripRepository tripRepository,
                           VehicleRepository vehicleRepository,
                           UserRepository userRepository,
                           BookingRepository bookingRepository,
                           ReferenceResolver referenceResolver,
                           @Value("${app.trips.strict-references:false}") boolean strictReferences,
                           @Value("${app.routes.enforce-arrival-order:false}") boolean enforceRouteOrder) {
        this.tripRepository = tripRepository;
        this.vehicleRepository = vehicleRepository;
        this.userRepository = userRepository;
        this.bookingRepository = bookingRepository;
        this.referenceResolver = referenceResolver;
        this.strictReferences = strictReferences;
        this.enforceRouteOrder = enforceRouteOrder;
    }

    @Override
    public Trip createTrip(CreateTripRequest req) {
        List<String> bookingIds = req.bookings() == null ? new ArrayList<>() : new ArrayList<>(req.bookings());
        if (strictReferences) {
            checkReferences(req, bookingIds);
        }

        Trip trip = new Trip();
        trip.setVehicleId(req.vehicleId());
        trip.setDriverId(req.driverId());
        trip.setCoDriverId(req.coDriverId());
        trip.setBookings(bookingIds);
        if (req.route() != null) {
            CreateTripRequest.Route route = req.route();
            if (enforceRouteOrder && route.departureTime() != null && route.arrivalTime() != null
                    && route.arrivalTime().before(route.departureTime())) {
                throw new BadRequestException("route.arrivalTime must not be before route.departureTime");
            }
            trip.setRoute(new Trip.Route(route.from(), route.to(), route.departureTime(), route.arrivalTime()));
        }
        trip.setBorderControlPermit(req.borderControlPermit());
        trip.setTaxValuationPayment(req.taxValuationPayment());
        trip.setDeliveryConfirmationReceipt(req.deliveryConfirmationReceipt());
        trip.setStatus(TripStatus.SCHEDULED);
        Date now = new Date();
        trip.setCreatedAt(now);
        trip.setUpdatedAt(now);

        String baseId = TRIP_ID_PREFIX + now.getTime();
        for (int attempt = 1; attempt <= MAX_TRIP_ID_ATTEMPTS; attempt++) {
            trip.setTripId(attempt == 1 ? baseId : baseId + "-" + attempt);
            try {
                Trip saved = tripRepository.save(trip);
                logger.info("Trajet créé: {} (véhicule {}, chauffeur {}, {} réservations)",
                        saved.getTripId(), saved.getVehicleId(), saved.getDriverId(), bookingIds.size());
                return saved;
            } catch (DuplicateKeyException e) {
                logger.warn("Identifiant de trajet {} déjà pris (tentative {}/{})", trip.getTripId(), attempt, MAX_TRIP_ID_ATTEMPTS);
            }
        }
        throw new ApiException(HttpStatus.INTERNAL_SERVER_ERROR, "Could not allocate a unique trip id");
    }

    @Override
    public List<TripWithDetailsDTO> getTrips() {
        return referenceResolver.tripsWithDetails(tripRepository.findAllByOrderByCreatedAtDesc());
    }

    /**
     * fuelUsed and distance overwrite the stored values whenever they are sent.
     */
    @Override
    public Trip updateStatus(String tripId, UpdateTripStatusRequest req) {
        Trip trip = tripRepository.findById(tripId)
                .orElseThrow(() -> new ResourceNotFoundException("Trip not found"));
        TripStatus newStatus = CodedEnum.parse(TripStatus.class, req.status(), "status");

        trip.setStatus(newStatus);
        if (req.fuelUsed() != null) {
            trip.setFuelUsed(req.fuelUsed());
        }
        if (req.distance() != null) {
            trip.setDistance(req.distance());
        }
        trip.setUpdatedAt(new Date());
        Trip saved = tripRepository.save(trip);
        logger.info("Statut du trajet {} mis à jour: {}", tripId, newStatus.getValue());
        return saved;
    }

    private void checkReferences(CreateTripRequest req, List<String> bookingIds) {
        if (!vehicleRepository.existsById(req.vehicleId())) {
            throw new DanglingReferenceException("vehicle", req.vehicleId());
        }
        if (!userRepository.existsById(req.driverId())) {
            throw new DanglingReferenceException("driver", req.driverId());
        }
        if (req.coDriverId() != null && !userRepository.existsById(req.coDriverId())) {
            throw new DanglingReferenceException("coDriver", req.coDriverId());
        }
        for (String bookingId : bookingIds) {
            if (!bookingRepository.existsById(bookingId)) {
                throw new DanglingReferenceException("booking", bookingId);
            }
        }
    }
}
