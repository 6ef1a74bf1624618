package com.example.authservice.dto;

import com.example.authservice.token.TokenPair;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Login/Token response DTO.
 */
public record LoginResponse(
    @JsonProperty("accessToken")
    String accessToken,

    @JsonProperty("refreshToken")
    String refreshToken,

    @JsonProperty("tokenType")
    String tokenType,

    @JsonProperty("expiresIn")
    long expiresIn
) {
    /**
     * Factory method with default tokenType = "Bearer"
     */
    public static LoginResponse of(TokenPair pair) {
        return new LoginResponse(pair.accessToken(), pair.refreshToken(), "Bearer", pair.expiresIn());
    }
}
