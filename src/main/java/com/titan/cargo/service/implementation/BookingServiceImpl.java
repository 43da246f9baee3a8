package com.titan.cargo.service.implementation;

import com.titan.cargo.dto.in.CreateBookingRequest;
import com.titan.cargo.dto.out.BookingWithClientDTO;
import com.titan.cargo.exception.ApiException;
import com.titan.cargo.exception.BadRequestException;
import com.titan.cargo.exception.ForbiddenException;
import com.titan.cargo.exception.ResourceNotFoundException;
import com.titan.cargo.model.Booking;
import com.titan.cargo.model.enums.BookingStatus;
import com.titan.cargo.model.enums.CargoType;
import com.titan.cargo.model.enums.CodedEnum;
import com.titan.cargo.model.enums.PaymentStatus;
import com.titan.cargo.repository.BookingRepository;
import com.titan.cargo.security.AuthenticatedUser;
import com.titan.cargo.service.BookingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.util.Date;
import java.util.List;

@Service
public class BookingServiceImpl implements BookingService {

    private static final Logger logger = LoggerFactory.getLogger(BookingServiceImpl.class);

    static final String AIRWAY_BILL_PREFIX = "AWB";
    static final int MAX_AIRWAY_BILL_ATTEMPTS = 3;

    private static final String ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
    private static final int SUFFIX_LENGTH = 5;
    private static final SecureRandom random = new SecureRandom();

    private final BookingRepository bookingRepository;
    private final ReferenceResolver referenceResolver;
    private final boolean enforceStatusOwnership;
    private final boolean enforceRouteOrder;

    public BookingServiceImpl(BookingRepository bookingRepository,
                              ReferenceResolver referenceResolver,
                              @Value("${app.bookings.enforce-status-ownership:false}") boolean enforceStatusOwnership,
                              @Value("${app.routes.enforce-arrival-order:false}") boolean enforceRouteOrder) {
        this.bookingRepository = bookingRepository;
        this.referenceResolver = referenceResolver;
        this.enforceStatusOwnership = enforceStatusOwnership;
        this.enforceRouteOrder = enforceRouteOrder;
    }

    @Override
    public Booking createBooking(AuthenticatedUser caller, CreateBookingRequest req) {
        CreateBookingRequest.Route route = req.route();
        if (enforceRouteOrder && route.arrivalDate().before(route.departureDate())) {
            throw new BadRequestException("route.arrivalDate must not be before route.departureDate");
        }
        CreateBookingRequest.CargoDetails cargo = req.cargoDetails();
        CargoType cargoType = cargo.type() == null
                ? CargoType.GENERAL
                : CodedEnum.parse(CargoType.class, cargo.type(), "cargoDetails.type");

        Booking booking = new Booking();
        booking.setClientId(caller.userId());
        booking.setCargoDetails(new Booking.CargoDetails(
                cargo.description(),
                cargo.weight(),
                cargo.dimensions() == null ? null : new Booking.Dimensions(
                        cargo.dimensions().length(), cargo.dimensions().width(), cargo.dimensions().height()),
                cargoType));
        booking.setRoute(new Booking.Route(route.from(), route.to(), route.departureDate(), route.arrivalDate()));
        booking.setPrice(req.price());
        booking.setStatus(BookingStatus.PENDING);
        booking.setPaymentStatus(PaymentStatus.PENDING);
        Date now = new Date();
        booking.setCreatedAt(now);
        booking.setUpdatedAt(now);

        for (int attempt = 1; attempt <= MAX_AIRWAY_BILL_ATTEMPTS; attempt++) {
            booking.setAirwayBill(generateAirwayBill());
            try {
                Booking saved = bookingRepository.save(booking);
                logger.info("Réservation créée: {} pour le client {}", saved.getAirwayBill(), caller.userId());
                return saved;
            } catch (DuplicateKeyException e) {
                logger.warn("Collision de lettre de transport {} (tentative {}/{})",
                        booking.getAirwayBill(), attempt, MAX_AIRWAY_BILL_ATTEMPTS);
            }
        }
        throw new ApiException(HttpStatus.INTERNAL_SERVER_ERROR, "Could not allocate a unique airway bill");
    }

    @Override
    public List<BookingWithClientDTO> getBookings(AuthenticatedUser caller) {
        List<Booking> bookings = caller.isAdmin()
                ? bookingRepository.findAllByOrderByCreatedAtDesc()
                : bookingRepository.findByClientIdOrderByCreatedAtDesc(caller.userId());
        return referenceResolver.bookingsWithClients(bookings);
    }

    @Override
    public BookingWithClientDTO getBookingById(AuthenticatedUser caller, String bookingId) {
        Booking booking = findBooking(bookingId);
        checkAdminOrOwner(caller, booking);
        return referenceResolver.bookingWithClient(booking);
    }

    /**
     * Any authenticated caller may change any booking's status unless
     * {@code app.bookings.enforce-status-ownership} is set.
     */
    @Override
    public Booking updateStatus(AuthenticatedUser caller, String bookingId, String status) {
        Booking booking = findBooking(bookingId);
        BookingStatus newStatus = CodedEnum.parse(BookingStatus.class, status, "status");
        if (enforceStatusOwnership) {
            checkAdminOrOwner(caller, booking);
        }
        booking.setStatus(newStatus);
        booking.setUpdatedAt(new Date());
        Booking saved = bookingRepository.save(booking);
        logger.info("Statut de la réservation {} mis à jour: {} (par {})", bookingId, newStatus.getValue(), caller.userId());
        return saved;
    }

    @Override
    public Booking updatePaymentStatus(AuthenticatedUser caller, String bookingId, String paymentStatus) {
        Booking booking = findBooking(bookingId);
        PaymentStatus newStatus = CodedEnum.parse(PaymentStatus.class, paymentStatus, "paymentStatus");
        checkAdminOrOwner(caller, booking);
        booking.setPaymentStatus(newStatus);
        booking.setUpdatedAt(new Date());
        Booking saved = bookingRepository.save(booking);
        logger.info("Statut de paiement de la réservation {} mis à jour: {}", bookingId, newStatus.getValue());
        return saved;
    }

    private Booking findBooking(String bookingId) {
        return bookingRepository.findById(bookingId)
                .orElseThrow(() -> new ResourceNotFoundException("Booking not found"));
    }

    private void checkAdminOrOwner(AuthenticatedUser caller, Booking booking) {
        if (!caller.isAdmin() && !caller.userId().equals(booking.getClientId())) {
            logger.warn("Accès refusé à la réservation {} pour l'utilisateur {}", booking.getId(), caller.userId());
            throw new ForbiddenException("Access denied");
        }
    }

    static String generateAirwayBill() {
        StringBuilder code = new StringBuilder(AIRWAY_BILL_PREFIX).append(System.currentTimeMillis());
        for (int i = 0; i < SUFFIX_LENGTH; i++) {
            code.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return code.toString();
    }
}
