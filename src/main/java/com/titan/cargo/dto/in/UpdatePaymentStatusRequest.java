package com.titan.cargo.dto.in;

public record UpdatePaymentStatusRequest(String paymentStatus) {}
