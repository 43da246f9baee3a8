package com.titan.cargo.service.implementation;

import com.titan.cargo.dto.out.DashboardStatsDTO;
import com.titan.cargo.model.Booking;
import com.titan.cargo.model.enums.PaymentStatus;
import com.titan.cargo.model.enums.TripStatus;
import com.titan.cargo.repository.BookingRepository;
import com.titan.cargo.repository.TripRepository;
import com.titan.cargo.repository.VehicleRepository;
import com.titan.cargo.service.DashboardService;
import org.bson.Document;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.stereotype.Service;

@Service
public class DashboardServiceImpl implements DashboardService {

    private final BookingRepository bookingRepository;
    private final TripRepository tripRepository;
    private final VehicleRepository vehicleRepository;
    private final MongoTemplate mongoTemplate;
    private final ReferenceResolver referenceResolver;

    public DashboardServiceImpl(BookingRepository bookingRepository,
                                TripRepository tripRepository,
                                VehicleRepository vehicleRepository,
                                MongoTemplate mongoTemplate,
                                ReferenceResolver referenceResolver) {
        this.bookingRepository = bookingRepository;
        this.tripRepository = tripRepository;
        this.vehicleRepository = vehicleRepository;
        this.mongoTemplate = mongoTemplate;
        this.referenceResolver = referenceResolver;
    }

    @Override
    public DashboardStatsDTO getStats() {
        DashboardStatsDTO.Stats stats = new DashboardStatsDTO.Stats(
                bookingRepository.count(),
                totalRevenue(),
                tripRepository.count(),
                vehicleRepository.count()
        );
        return new DashboardStatsDTO(
                stats,
                referenceResolver.bookingsWithClients(bookingRepository.findTop10ByOrderByCreatedAtDesc()),
                referenceResolver.tripsWithDetails(tripRepository.findByStatus(TripStatus.IN_PROGRESS))
        );
    }

    /**
     * Sum of price over paid bookings, 0 when there are none.
     */
    double totalRevenue() {
        Aggregation aggregation = Aggregation.newAggregation(
                Aggregation.match(Criteria.where("paymentStatus").is(PaymentStatus.PAID.name())),
                Aggregation.group().sum("price").as("total")
        );
        Document result = mongoTemplate.aggregate(aggregation, Booking.class, Document.class).getUniqueMappedResult();
        if (result != null && result.get("total") instanceof Number total) {
            return total.doubleValue();
        }
        return 0;
    }
}
