package com.titan.cargo.dto.out;

import com.titan.cargo.model.User;

public record ProfileResponse(
        String message,
        User user
) {}
