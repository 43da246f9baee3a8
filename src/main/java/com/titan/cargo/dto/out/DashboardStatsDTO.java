package com.titan.cargo.dto.out;

import java.util.List;

public record DashboardStatsDTO(
        Stats stats,
        List<BookingWithClientDTO> recentBookings,
        List<TripWithDetailsDTO> activeTrips
) {

    public record Stats(
            long totalBookings,
            double totalRevenue,
            long totalTrips,
            long totalVehicles
    ) {}
}
