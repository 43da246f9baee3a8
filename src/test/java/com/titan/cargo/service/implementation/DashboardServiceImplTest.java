package com.titan.cargo.service.implementation;

import com.titan.cargo.dto.out.DashboardStatsDTO;
import com.titan.cargo.model.Booking;
import com.titan.cargo.model.enums.TripStatus;
import com.titan.cargo.repository.BookingRepository;
import com.titan.cargo.repository.TripRepository;
import com.titan.cargo.repository.VehicleRepository;
import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.data.mongodb.core.aggregation.AggregationResults;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DashboardServiceImplTest {

    @Mock
    private BookingRepository bookingRepository;

    @Mock
    private TripRepository tripRepository;

    @Mock
    private VehicleRepository vehicleRepository;

    @Mock
    private MongoTemplate mongoTemplate;

    @Mock
    private ReferenceResolver referenceResolver;

    private DashboardServiceImpl dashboardService;

    @BeforeEach
    void setUp() {
        dashboardService = new DashboardServiceImpl(bookingRepository, tripRepository, vehicleRepository,
                mongoTemplate, referenceResolver);
    }

    @Test
    void statsCombineCountsRevenueAndRecentActivity() {
        when(bookingRepository.count()).thenReturn(12L);
        when(tripRepository.count()).thenReturn(3L);
        when(vehicleRepository.count()).thenReturn(4L);
        aggregationReturns(List.of(new Document("total", 2500.0)));

        DashboardStatsDTO dto = dashboardService.getStats();

        assertEquals(12L, dto.stats().totalBookings());
        assertEquals(2500.0, dto.stats().totalRevenue());
        assertEquals(3L, dto.stats().totalTrips());
        assertEquals(4L, dto.stats().totalVehicles());
        verify(bookingRepository).findTop10ByOrderByCreatedAtDesc();
        verify(tripRepository).findByStatus(TripStatus.IN_PROGRESS);
    }

    @Test
    void revenueSumsPriceOverPaidBookingsOnly() {
        aggregationReturns(List.of(new Document("total", 2500.0)));

        dashboardService.totalRevenue();

        ArgumentCaptor<Aggregation> captor = ArgumentCaptor.forClass(Aggregation.class);
        verify(mongoTemplate).aggregate(captor.capture(), eq(Booking.class), eq(Document.class));
        List<Document> pipeline = captor.getValue().toPipeline(Aggregation.DEFAULT_CONTEXT);

        assertEquals(2, pipeline.size());
        assertEquals(new Document("$match", new Document("paymentStatus", "PAID")), pipeline.get(0));
        Document group = pipeline.get(1).get("$group", Document.class);
        assertNotNull(group);
        assertNull(group.get("_id"));
        assertEquals("$price", group.get("total", Document.class).get("$sum"));
    }

    @Test
    void revenueIsZeroWithoutPaidBookings() {
        aggregationReturns(List.of());

        assertEquals(0.0, dashboardService.totalRevenue());
    }

    @Test
    void integerTotalsAreWidened() {
        aggregationReturns(List.of(new Document("total", 700)));

        assertEquals(700.0, dashboardService.totalRevenue());
    }

    private void aggregationReturns(List<Document> documents) {
        when(mongoTemplate.aggregate(any(Aggregation.class), eq(Booking.class), eq(Document.class)))
                .thenReturn(new AggregationResults<>(documents, new Document()));
    }
}
