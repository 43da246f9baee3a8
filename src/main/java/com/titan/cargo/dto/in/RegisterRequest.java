package com.titan.cargo.dto.in;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;

public record RegisterRequest(
        @NotBlank(message = "Name is required")
        String name,

        @Email(message = "Please provide a valid email")
        @NotBlank(message = "Email is required")
        String email,

        @NotBlank(message = "Password is required")
        String password,

        String role,
        String phone,
        String address
) {
    @Override
    public String toString() {
        return "RegisterRequest[name=" + name + ", email=" + email + ", role=" + role + "]";
    }
}
