package com.example.authservice.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;

/**
 * Token settings bound from the {@code jwt.*} keys.
 *
 * @param secret          newest HMAC secret, used to sign
 * @param previousSecrets older secrets still accepted for verification, newest first
 * @param issuer          value of the {@code iss} claim
 * @param accessTokenTtl  access token lifetime
 * @param refreshTokenTtl refresh token lifetime
 * @param resetTokenTtl   password-reset token lifetime
 * @param clockSkew       tolerance applied to {@code exp} checks, 0 to 30 seconds
 */
@ConfigurationProperties(prefix = "jwt")
public record TokenProperties(
        String secret,
        List<String> previousSecrets,
        String issuer,
        Duration accessTokenTtl,
        Duration refreshTokenTtl,
        Duration resetTokenTtl,
        Duration clockSkew) {

    public static final Duration MAX_CLOCK_SKEW = Duration.ofSeconds(30);

    public TokenProperties {
        if (previousSecrets == null) {
            previousSecrets = List.of();
        }
        if (issuer == null || issuer.isBlank()) {
            issuer = "auth-service";
        }
        if (accessTokenTtl == null) {
            accessTokenTtl = Duration.ofMinutes(60);
        }
        if (refreshTokenTtl == null) {
            refreshTokenTtl = Duration.ofDays(7);
        }
        if (resetTokenTtl == null) {
            resetTokenTtl = Duration.ofMinutes(15);
        }
        if (clockSkew == null) {
            clockSkew = MAX_CLOCK_SKEW;
        }
        if (clockSkew.isNegative() || clockSkew.compareTo(MAX_CLOCK_SKEW) > 0) {
            throw new IllegalStateException("jwt.clock-skew must be between 0s and 30s, was " + clockSkew);
        }
    }
}
