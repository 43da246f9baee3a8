package com.titan.cargo.dto.in;

/**
 * Null fields are left untouched.
 */
public record UpdateProfileRequest(
        String name,
        String phone,
        String address
) {}
