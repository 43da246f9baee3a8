package com.titan.cargo.service;

import com.titan.cargo.dto.in.CreateBookingRequest;
import com.titan.cargo.dto.out.BookingWithClientDTO;
import com.titan.cargo.model.Booking;
import com.titan.cargo.security.AuthenticatedUser;

import java.util.List;

public interface BookingService {

    Booking createBooking(AuthenticatedUser caller, CreateBookingRequest request);

    /**
     * Admins see every booking, other roles only their own. Newest first.
     */
    List<BookingWithClientDTO> getBookings(AuthenticatedUser caller);

    BookingWithClientDTO getBookingById(AuthenticatedUser caller, String bookingId);

    Booking updateStatus(AuthenticatedUser caller, String bookingId, String status);

    Booking updatePaymentStatus(AuthenticatedUser caller, String bookingId, String paymentStatus);
}
