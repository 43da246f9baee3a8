package com.titan.cargo.service.implementation;

import com.titan.cargo.dto.out.BookingWithClientDTO;
import com.titan.cargo.dto.out.TripWithDetailsDTO;
import com.titan.cargo.dto.out.VehicleWithDriverDTO;
import com.titan.cargo.model.Booking;
import com.titan.cargo.model.Trip;
import com.titan.cargo.model.User;
import com.titan.cargo.model.Vehicle;
import com.titan.cargo.model.mapper.DisplayMapper;
import com.titan.cargo.repository.BookingRepository;
import com.titan.cargo.repository.UserRepository;
import com.titan.cargo.repository.VehicleRepository;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;

/**
 * Resolves id references to documents for display, one batched lookup per collection.
 * References that no longer exist resolve to null, or are skipped inside lists.
 */
@Component
public class ReferenceResolver {

    private final UserRepository userRepository;
    private final VehicleRepository vehicleRepository;
    private final BookingRepository bookingRepository;

    public ReferenceResolver(UserRepository userRepository,
                             VehicleRepository vehicleRepository,
                             BookingRepository bookingRepository) {
        this.userRepository = userRepository;
        this.vehicleRepository = vehicleRepository;
        this.bookingRepository = bookingRepository;
    }

    public List<BookingWithClientDTO> bookingsWithClients(List<Booking> bookings) {
        Map<String, User> clients = loadUsers(bookings.stream().map(Booking::getClientId).collect(Collectors.toSet()));
        return bookings.stream()
                .map(b -> DisplayMapper.toBookingWithClient(b, lookup(clients, b.getClientId())))
                .collect(Collectors.toList());
    }

    public BookingWithClientDTO bookingWithClient(Booking booking) {
        return bookingsWithClients(List.of(booking)).get(0);
    }

    public List<VehicleWithDriverDTO> vehiclesWithDrivers(List<Vehicle> vehicles) {
        Map<String, User> drivers = loadUsers(vehicles.stream().map(Vehicle::getAssignedDriver).collect(Collectors.toSet()));
        return vehicles.stream()
                .map(v -> DisplayMapper.toVehicleWithDriver(v, lookup(drivers, v.getAssignedDriver())))
                .collect(Collectors.toList());
    }

    public List<TripWithDetailsDTO> tripsWithDetails(List<Trip> trips) {
        Set<String> userIds = new HashSet<>();
        Set<String> vehicleIds = new HashSet<>();
        Set<String> bookingIds = new HashSet<>();
        for (Trip trip : trips) {
            userIds.add(trip.getDriverId());
            userIds.add(trip.getCoDriverId());
            vehicleIds.add(trip.getVehicleId());
            if (trip.getBookings() != null) {
                bookingIds.addAll(trip.getBookings());
            }
        }

        Map<String, User> users = loadUsers(userIds);
        Map<String, Vehicle> vehicles = index(vehicleRepository.findAllById(withoutNulls(vehicleIds)), Vehicle::getId);
        Map<String, Booking> bookings = index(bookingRepository.findAllById(withoutNulls(bookingIds)), Booking::getId);

        return trips.stream()
                .map(trip -> DisplayMapper.toTripWithDetails(
                        trip,
                        lookup(vehicles, trip.getVehicleId()),
                        lookup(users, trip.getDriverId()),
                        lookup(users, trip.getCoDriverId()),
                        trip.getBookings() == null ? List.of() : trip.getBookings().stream()
                                .map(bookings::get)
                                .filter(Objects::nonNull)
                                .collect(Collectors.toList())))
                .collect(Collectors.toList());
    }

    private Map<String, User> loadUsers(Set<String> ids) {
        return index(userRepository.findAllById(withoutNulls(ids)), User::getId);
    }

    private static Set<String> withoutNulls(Set<String> ids) {
        return ids.stream().filter(Objects::nonNull).collect(Collectors.toSet());
    }

    private static <T> Map<String, T> index(Iterable<T> documents, Function<T, String> idOf) {
        return StreamSupport.stream(documents.spliterator(), false)
                .collect(Collectors.toMap(idOf, Function.identity(), (a, b) -> a));
    }

    private static <T> T lookup(Map<String, T> index, String id) {
        return id == null ? null : index.get(id);
    }
}
