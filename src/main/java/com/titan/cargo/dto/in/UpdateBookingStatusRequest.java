package com.titan.cargo.dto.in;

public record UpdateBookingStatusRequest(String status) {}
