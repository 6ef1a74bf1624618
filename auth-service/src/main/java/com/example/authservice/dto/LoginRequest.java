package com.example.authservice.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Login request DTO. The email format is not validated here so that a malformed
 * email fails like any other wrong credential.
 */
public record LoginRequest(
    @NotBlank(message = "Email is required")
    String email,

    @NotBlank(message = "Password is required")
    String password
) {
}
