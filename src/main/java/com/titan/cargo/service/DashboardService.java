package com.titan.cargo.service;

import com.titan.cargo.dto.out.DashboardStatsDTO;

public interface DashboardService {
    DashboardStatsDTO getStats();
}
