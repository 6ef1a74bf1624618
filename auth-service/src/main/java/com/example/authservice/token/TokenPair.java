package com.example.authservice.token;

/**
 * Signed access/refresh tokens returned by login and rotation.
 *
 * @param expiresIn access token lifetime in seconds
 */
public record TokenPair(
        String accessToken,
        String refreshToken,
        long expiresIn,
        TokenClaims accessClaims,
        TokenClaims refreshClaims) {
}
