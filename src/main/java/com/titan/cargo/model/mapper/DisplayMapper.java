package com.titan.cargo.model.mapper;

import com.titan.cargo.dto.out.BookingWithClientDTO;
import com.titan.cargo.dto.out.TripWithDetailsDTO;
import com.titan.cargo.dto.out.UserRefDTO;
import com.titan.cargo.dto.out.UserSummary;
import com.titan.cargo.dto.out.VehicleWithDriverDTO;
import com.titan.cargo.model.Booking;
import com.titan.cargo.model.Trip;
import com.titan.cargo.model.User;
import com.titan.cargo.model.Vehicle;

import java.util.List;

/**
 * Builds the display shapes with their references already resolved. A missing reference maps to null.
 */
public class DisplayMapper {

    private DisplayMapper() {
    }

    public static UserSummary toSummary(User user) {
        if (user == null) {
            return null;
        }
        return new UserSummary(user.getId(), user.getName(), user.getEmail(), user.getRole());
    }

    public static UserRefDTO toClientRef(User user) {
        if (user == null) {
            return null;
        }
        return new UserRefDTO(user.getId(), user.getName(), user.getEmail());
    }

    public static UserRefDTO toNameRef(User user) {
        if (user == null) {
            return null;
        }
        return new UserRefDTO(user.getId(), user.getName(), null);
    }

    public static BookingWithClientDTO toBookingWithClient(Booking booking, User client) {
        return new BookingWithClientDTO(
                booking.getId(),
                booking.getAirwayBill(),
                toClientRef(client),
                booking.getCargoDetails(),
                booking.getRoute(),
                booking.getStatus(),
                booking.getPrice(),
                booking.getPaymentStatus(),
                booking.getCreatedAt(),
                booking.getUpdatedAt()
        );
    }

    public static VehicleWithDriverDTO toVehicleWithDriver(Vehicle vehicle, User driver) {
        return new VehicleWithDriverDTO(
                vehicle.getId(),
                vehicle.getVehicleId(),
                vehicle.getType(),
                vehicle.getModel(),
                vehicle.getCapacity(),
                vehicle.getStatus(),
                vehicle.getCurrentLocation(),
                toNameRef(driver),
                vehicle.getCreatedAt()
        );
    }

    public static TripWithDetailsDTO toTripWithDetails(Trip trip, Vehicle vehicle, User driver, User coDriver,
                                                       List<Booking> bookings) {
        return new TripWithDetailsDTO(
                trip.getId(),
                trip.getTripId(),
                vehicle,
                toNameRef(driver),
                toNameRef(coDriver),
                bookings,
                trip.getRoute(),
                trip.getFuelUsed(),
                trip.getDistance(),
                trip.getStatus(),
                trip.getBorderControlPermit(),
                trip.getTaxValuationPayment(),
                trip.getDeliveryConfirmationReceipt(),
                trip.getCreatedAt(),
                trip.getUpdatedAt()
        );
    }
}
