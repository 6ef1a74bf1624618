package com.example.authservice.dto;

import com.example.authservice.token.TokenClaims;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Resolved access token claims, as returned by /me and /authorize.
 */
public record ClaimsResponse(
    @JsonProperty("subjectId")
    Long subjectId,

    @JsonProperty("email")
    String email,

    @JsonProperty("role")
    String role,

    @JsonProperty("tokenId")
    String tokenId,

    @JsonProperty("expiresAt")
    Instant expiresAt
) {
    public static ClaimsResponse from(TokenClaims claims) {
        return new ClaimsResponse(
            claims.subjectId(),
            claims.email(),
            claims.role(),
            claims.tokenId(),
            claims.expiresAt()
        );
    }
}
