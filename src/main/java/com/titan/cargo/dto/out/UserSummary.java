package com.titan.cargo.dto.out;

import com.titan.cargo.model.enums.Role;

public record UserSummary(
        String id,
        String name,
        String email,
        Role role
) {}
