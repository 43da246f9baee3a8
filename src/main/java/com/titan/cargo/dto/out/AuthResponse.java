package com.titan.cargo.dto.out;

public record AuthResponse(
        String message,
        String token,
        UserSummary user
) {}
