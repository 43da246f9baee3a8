package com.titan.cargo.service.implementation;

import com.titan.cargo.dto.in.CreateBookingRequest;
import com.titan.cargo.exception.ApiException;
import com.titan.cargo.exception.BadRequestException;
import com.titan.cargo.exception.ForbiddenException;
import com.titan.cargo.exception.ResourceNotFoundException;
import com.titan.cargo.model.Booking;
import com.titan.cargo.model.enums.BookingStatus;
import com.titan.cargo.model.enums.CargoType;
import com.titan.cargo.model.enums.PaymentStatus;
import com.titan.cargo.model.enums.Role;
import com.titan.cargo.repository.BookingRepository;
import com.titan.cargo.security.AuthenticatedUser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.http.HttpStatus;

import java.util.Date;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BookingServiceImplTest {

    private static final AuthenticatedUser ADMIN = new AuthenticatedUser("admin-1", "admin@titan.test", Role.ADMIN);
    private static final AuthenticatedUser OWNER = new AuthenticatedUser("user-1", "owner@titan.test", Role.USER);
    private static final AuthenticatedUser STRANGER = new AuthenticatedUser("user-2", "other@titan.test", Role.DRIVER);

    @Mock
    private BookingRepository bookingRepository;

    @Mock
    private ReferenceResolver referenceResolver;

    private BookingServiceImpl bookingService;

    @BeforeEach
    void setUp() {
        bookingService = new BookingServiceImpl(bookingRepository, referenceResolver, false, false);
    }

    @Test
    void createBookingStartsPendingWithAirwayBill() {
        when(bookingRepository.save(any(Booking.class))).thenAnswer(inv -> inv.getArgument(0));

        Booking booking = bookingService.createBooking(OWNER, request(null, day(1), day(3)));

        assertTrue(booking.getAirwayBill().matches("AWB\\d+[A-Z0-9]{5}"), booking.getAirwayBill());
        assertEquals("user-1", booking.getClientId());
        assertEquals(BookingStatus.PENDING, booking.getStatus());
        assertEquals(PaymentStatus.PENDING, booking.getPaymentStatus());
        assertEquals(CargoType.GENERAL, booking.getCargoDetails().getType());
        assertEquals(1200.0, booking.getPrice());
        assertNotNull(booking.getCreatedAt());
    }

    @Test
    void createBookingRetriesOnAirwayBillCollision() {
        when(bookingRepository.save(any(Booking.class)))
                .thenThrow(new DuplicateKeyException("E11000 airwayBill"))
                .thenAnswer(inv -> inv.getArgument(0));

        Booking booking = bookingService.createBooking(OWNER, request("perishable", day(1), day(2)));

        assertEquals(CargoType.PERISHABLE, booking.getCargoDetails().getType());
        verify(bookingRepository, times(2)).save(any(Booking.class));
    }

    @Test
    void createBookingGivesUpAfterRepeatedCollisions() {
        when(bookingRepository.save(any(Booking.class))).thenThrow(new DuplicateKeyException("E11000 airwayBill"));

        ApiException ex = assertThrows(ApiException.class,
                () -> bookingService.createBooking(OWNER, request(null, day(1), day(2))));

        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, ex.getStatus());
        verify(bookingRepository, times(BookingServiceImpl.MAX_AIRWAY_BILL_ATTEMPTS)).save(any(Booking.class));
    }

    @Test
    void createBookingRejectsArrivalBeforeDepartureWhenOrderIsEnforced() {
        BookingServiceImpl ordered = new BookingServiceImpl(bookingRepository, referenceResolver, false, true);

        assertThrows(BadRequestException.class,
                () -> ordered.createBooking(OWNER, request(null, day(3), day(1))));
        verifyNoInteractions(bookingRepository);
    }

    @Test
    void createBookingAcceptsReversedRouteByDefault() {
        when(bookingRepository.save(any(Booking.class))).thenAnswer(inv -> inv.getArgument(0));

        Booking booking = bookingService.createBooking(OWNER, request(null, day(3), day(1)));

        assertEquals(day(1), booking.getRoute().getArrivalDate());
    }

    @Test
    void createBookingRejectsUnknownCargoType() {
        BadRequestException ex = assertThrows(BadRequestException.class,
                () -> bookingService.createBooking(OWNER, request("explosive", day(1), day(2))));
        assertTrue(ex.getMessage().startsWith("Invalid cargoDetails.type 'explosive'"));
    }

    @Test
    void adminListsEveryBookingOthersOnlyTheirOwn() {
        bookingService.getBookings(ADMIN);
        verify(bookingRepository).findAllByOrderByCreatedAtDesc();

        bookingService.getBookings(OWNER);
        verify(bookingRepository).findByClientIdOrderByCreatedAtDesc("user-1");
    }

    @Test
    void strangerCannotReadBooking() {
        when(bookingRepository.findById("b-1")).thenReturn(Optional.of(stored("b-1", "user-1")));

        ForbiddenException ex = assertThrows(ForbiddenException.class,
                () -> bookingService.getBookingById(STRANGER, "b-1"));
        assertEquals("Access denied", ex.getMessage());
    }

    @Test
    void ownerAndAdminCanReadBooking() {
        Booking booking = stored("b-1", "user-1");
        when(bookingRepository.findById("b-1")).thenReturn(Optional.of(booking));

        bookingService.getBookingById(OWNER, "b-1");
        bookingService.getBookingById(ADMIN, "b-1");

        verify(referenceResolver, times(2)).bookingWithClient(booking);
    }

    @Test
    void missingBookingIsNotFound() {
        when(bookingRepository.findById("nope")).thenReturn(Optional.empty());

        ResourceNotFoundException ex = assertThrows(ResourceNotFoundException.class,
                () -> bookingService.getBookingById(ADMIN, "nope"));
        assertEquals("Booking not found", ex.getMessage());
    }

    @Test
    void missingBookingWinsOverInvalidStatus() {
        when(bookingRepository.findById("nope")).thenReturn(Optional.empty());

        assertThrows(ResourceNotFoundException.class,
                () -> bookingService.updateStatus(OWNER, "nope", "shipped"));
    }

    @Test
    void invalidStatusIsRejected() {
        when(bookingRepository.findById("b-1")).thenReturn(Optional.of(stored("b-1", "user-1")));

        assertThrows(BadRequestException.class, () -> bookingService.updateStatus(OWNER, "b-1", "shipped"));
        verify(bookingRepository, never()).save(any());
    }

    @Test
    void anyCallerMayUpdateStatusByDefault() {
        Booking booking = stored("b-1", "user-1");
        when(bookingRepository.findById("b-1")).thenReturn(Optional.of(booking));
        when(bookingRepository.save(any(Booking.class))).thenAnswer(inv -> inv.getArgument(0));

        Booking updated = bookingService.updateStatus(STRANGER, "b-1", "confirmed");

        assertEquals(BookingStatus.CONFIRMED, updated.getStatus());
        assertTrue(updated.getUpdatedAt().after(updated.getCreatedAt()));
    }

    @Test
    void statusOwnershipCanBeEnforced() {
        BookingServiceImpl strict = new BookingServiceImpl(bookingRepository, referenceResolver, true, false);
        when(bookingRepository.findById("b-1")).thenReturn(Optional.of(stored("b-1", "user-1")));

        assertThrows(ForbiddenException.class, () -> strict.updateStatus(STRANGER, "b-1", "confirmed"));
    }

    @Test
    void paymentStatusRequiresAdminOrOwner() {
        Booking booking = stored("b-1", "user-1");
        when(bookingRepository.findById("b-1")).thenReturn(Optional.of(booking));
        when(bookingRepository.save(any(Booking.class))).thenAnswer(inv -> inv.getArgument(0));

        assertThrows(ForbiddenException.class, () -> bookingService.updatePaymentStatus(STRANGER, "b-1", "paid"));

        Booking paid = bookingService.updatePaymentStatus(ADMIN, "b-1", "paid");
        assertEquals(PaymentStatus.PAID, paid.getPaymentStatus());
    }

    private static CreateBookingRequest request(String cargoType, Date departure, Date arrival) {
        return new CreateBookingRequest(
                new CreateBookingRequest.CargoDetails("Machine parts", 250.0,
                        new CreateBookingRequest.Dimensions(1.0, 1.0, 1.5), cargoType),
                new CreateBookingRequest.Route("JFK", "LHR", departure, arrival),
                1200.0);
    }

    private static Booking stored(String id, String clientId) {
        Booking booking = new Booking();
        booking.setId(id);
        booking.setClientId(clientId);
        booking.setAirwayBill("AWB1700000000000ABCDE");
        booking.setCreatedAt(new Date(0));
        booking.setUpdatedAt(new Date(0));
        return booking;
    }

    private static Date day(int n) {
        return new Date(1_735_689_600_000L + n * 86_400_000L);
    }
}
