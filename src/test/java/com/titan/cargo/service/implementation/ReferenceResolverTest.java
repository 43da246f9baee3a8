package com.titan.cargo.service.implementation;

import com.titan.cargo.dto.out.BookingWithClientDTO;
import com.titan.cargo.dto.out.TripWithDetailsDTO;
import com.titan.cargo.model.Booking;
import com.titan.cargo.model.Trip;
import com.titan.cargo.model.User;
import com.titan.cargo.model.Vehicle;
import com.titan.cargo.repository.BookingRepository;
import com.titan.cargo.repository.UserRepository;
import com.titan.cargo.repository.VehicleRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ReferenceResolverTest {

    @Mock
    private UserRepository userRepository;

    @Mock
    private VehicleRepository vehicleRepository;

    @Mock
    private BookingRepository bookingRepository;

    private ReferenceResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new ReferenceResolver(userRepository, vehicleRepository, bookingRepository);
    }

    @Test
    void bookingsCarryClientNameAndEmail() {
        when(userRepository.findAllById(any())).thenReturn(List.of(user("u-1", "Ada", "ada@titan.test")));

        List<BookingWithClientDTO> result = resolver.bookingsWithClients(
                List.of(booking("b-1", "u-1"), booking("b-2", "u-gone")));

        assertEquals("Ada", result.get(0).client().name());
        assertEquals("ada@titan.test", result.get(0).client().email());
        assertNull(result.get(1).client());
        verify(userRepository, times(1)).findAllById(any());
    }

    @Test
    void tripsSkipDanglingBookingsAndKeepOrder() {
        Trip trip = new Trip();
        trip.setId("t-1");
        trip.setVehicleId("v-1");
        trip.setDriverId("d-1");
        trip.setCoDriverId("d-gone");
        trip.setBookings(List.of("b-2", "b-gone", "b-1"));

        Vehicle vehicle = new Vehicle();
        vehicle.setId("v-1");
        vehicle.setVehicleId("TC-PL-001");

        when(userRepository.findAllById(any())).thenReturn(List.of(user("d-1", "Pilot Pete", "pete@titan.test")));
        when(vehicleRepository.findAllById(any())).thenReturn(List.of(vehicle));
        when(bookingRepository.findAllById(any())).thenReturn(List.of(booking("b-1", "u-1"), booking("b-2", "u-1")));

        TripWithDetailsDTO dto = resolver.tripsWithDetails(List.of(trip)).get(0);

        assertEquals("TC-PL-001", dto.vehicle().getVehicleId());
        assertEquals("Pilot Pete", dto.driver().name());
        assertNull(dto.driver().email());
        assertNull(dto.coDriver());
        assertEquals(List.of("b-2", "b-1"), dto.bookings().stream().map(Booking::getId).toList());
    }

    private static User user(String id, String name, String email) {
        User user = new User();
        user.setId(id);
        user.setName(name);
        user.setEmail(email);
        return user;
    }

    private static Booking booking(String id, String clientId) {
        Booking booking = new Booking();
        booking.setId(id);
        booking.setClientId(clientId);
        return booking;
    }
}
