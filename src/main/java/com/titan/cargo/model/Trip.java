package com.titan.cargo.model;

import com.titan.cargo.model.enums.TripStatus;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.util.ArrayList;
import java.util.Date;
import java.util.List;

@Data
@NoArgsConstructor
@Document(collection = "trips")
public class Trip {

    @Id
    private String id;

    @Indexed(unique = true)
    private String tripId;

    private String vehicleId;
    private String driverId;
    private String coDriverId;
    private List<String> bookings = new ArrayList<>();

    private Route route;

    private Double fuelUsed;
    private Double distance;
    private TripStatus status = TripStatus.SCHEDULED;

    private String borderControlPermit;
    private Double taxValuationPayment;
    private String deliveryConfirmationReceipt;

    private Date createdAt;
    private Date updatedAt;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Route {
        private String from;
        private String to;
        private Date departureTime;
        private Date arrivalTime;
    }
}
