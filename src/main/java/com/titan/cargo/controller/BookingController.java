package com.titan.cargo.controller;

import com.titan.cargo.dto.in.CreateBookingRequest;
import com.titan.cargo.dto.in.UpdateBookingStatusRequest;
import com.titan.cargo.dto.in.UpdatePaymentStatusRequest;
import com.titan.cargo.dto.out.BookingResponse;
import com.titan.cargo.dto.out.BookingWithClientDTO;
import com.titan.cargo.model.Booking;
import com.titan.cargo.security.AuthenticatedUser;
import com.titan.cargo.service.BookingService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/bookings")
@Tag(name = "Réservations", description = "Réservations de fret et leur cycle de vie.")
public class BookingController {

    private final BookingService bookingService;

    public BookingController(BookingService bookingService) {
        this.bookingService = bookingService;
    }

    @Operation(summary = "Créer une réservation",
            description = "Génère une lettre de transport unique; statut et paiement démarrent à 'pending'.")
    @PostMapping
    public ResponseEntity<BookingResponse> createBooking(@AuthenticationPrincipal AuthenticatedUser caller,
                                                         @Valid @RequestBody CreateBookingRequest request) {
        Booking booking = bookingService.createBooking(caller, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(new BookingResponse("Booking created successfully", booking));
    }

    @Operation(summary = "Lister les réservations",
            description = "Un ADMIN voit toutes les réservations, les autres rôles uniquement les leurs.")
    @GetMapping
    public ResponseEntity<List<BookingWithClientDTO>> getBookings(@AuthenticationPrincipal AuthenticatedUser caller) {
        return ResponseEntity.ok(bookingService.getBookings(caller));
    }

    @Operation(summary = "Détail d'une réservation")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Réservation trouvée"),
            @ApiResponse(responseCode = "403", description = "Ni ADMIN ni propriétaire"),
            @ApiResponse(responseCode = "404", description = "Réservation non trouvée")
    })
    @GetMapping("/{id}")
    public ResponseEntity<BookingWithClientDTO> getBookingById(@AuthenticationPrincipal AuthenticatedUser caller,
                                                               @PathVariable String id) {
        return ResponseEntity.ok(bookingService.getBookingById(caller, id));
    }

    @Operation(summary = "Changer le statut d'une réservation")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Statut mis à jour"),
            @ApiResponse(responseCode = "400", description = "Statut inconnu"),
            @ApiResponse(responseCode = "404", description = "Réservation non trouvée")
    })
    @PutMapping("/{id}/status")
    public ResponseEntity<BookingResponse> updateStatus(@AuthenticationPrincipal AuthenticatedUser caller,
                                                        @PathVariable String id,
                                                        @RequestBody UpdateBookingStatusRequest request) {
        Booking booking = bookingService.updateStatus(caller, id, request.status());
        return ResponseEntity.ok(new BookingResponse("Booking status updated", booking));
    }

    @Operation(summary = "Changer le statut de paiement", description = "Réservé à l'ADMIN ou au propriétaire.")
    @PutMapping("/{id}/payment")
    public ResponseEntity<BookingResponse> updatePaymentStatus(@AuthenticationPrincipal AuthenticatedUser caller,
                                                               @PathVariable String id,
                                                               @RequestBody UpdatePaymentStatusRequest request) {
        Booking booking = bookingService.updatePaymentStatus(caller, id, request.paymentStatus());
        return ResponseEntity.ok(new BookingResponse("Booking payment status updated", booking));
    }
}
