package com.titan.cargo.model;

import com.titan.cargo.model.enums.BookingStatus;
import com.titan.cargo.model.enums.CargoType;
import com.titan.cargo.model.enums.PaymentStatus;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.util.Date;

@Data
@NoArgsConstructor
@Document(collection = "bookings")
public class Booking {

    @Id
    private String id;

    @Indexed(unique = true)
    private String airwayBill;

    // Owner, written once at creation.
    @Indexed
    private String clientId;

    private CargoDetails cargoDetails;
    private Route route;

    private BookingStatus status = BookingStatus.PENDING;
    private double price;
    private PaymentStatus paymentStatus = PaymentStatus.PENDING;

    private Date createdAt;
    private Date updatedAt;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CargoDetails {
        private String description;
        private double weight;
        private Dimensions dimensions;
        private CargoType type = CargoType.GENERAL;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Dimensions {
        private Double length;
        private Double width;
        private Double height;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Route {
        private String from;
        private String to;
        private Date departureDate;
        private Date arrivalDate;
    }
}
