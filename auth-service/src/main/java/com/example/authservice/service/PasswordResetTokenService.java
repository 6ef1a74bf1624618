package com.example.authservice.service;

import com.example.authservice.config.TokenProperties;
import com.example.authservice.entity.User;
import com.example.authservice.exception.MalformedTokenException;
import com.example.authservice.exception.TokenRevokedException;
import com.example.authservice.revocation.RevocationKeys;
import com.example.authservice.revocation.RevocationStore;
import com.example.authservice.token.JwtService;
import com.example.authservice.token.TokenClaims;
import com.example.authservice.token.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

/**
 * Single-use, purpose-scoped password reset tokens.
 *
 * A token moves only from unused to consumed. Consumption blacklists its jti
 * before returning, and stays consumed even if the password update afterwards fails.
 */
@Service
public class PasswordResetTokenService {

    private static final Logger log = LoggerFactory.getLogger(PasswordResetTokenService.class);

    public static final String PURPOSE = "password-reset";

    private final JwtService jwtService;
    private final RevocationStore revocationStore;
    private final TokenProperties properties;
    private final Clock clock;

    public PasswordResetTokenService(JwtService jwtService, RevocationStore revocationStore,
                                     TokenProperties properties, Clock clock) {
        this.jwtService = jwtService;
        this.revocationStore = revocationStore;
        this.properties = properties;
        this.clock = clock;
    }

    public String issue(User user) {
        Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        TokenClaims claims = TokenClaims.passwordReset(
                UUID.randomUUID().toString(), user.getId(), user.getEmail(), PURPOSE,
                now, now.plus(properties.resetTokenTtl()));
        return jwtService.encode(claims);
    }

    /**
     * Validate and burn a reset token.
     *
     * @return subject the token was issued for
     * @throws TokenRevokedException   already consumed
     * @throws MalformedTokenException not a reset token
     */
    public Long consume(String token) {
        TokenClaims claims = jwtService.decode(token).requireType(TokenType.PASSWORD_RESET);
        if (!PURPOSE.equals(claims.purpose())) {
            throw new MalformedTokenException("Unexpected token purpose");
        }

        boolean firstUse = revocationStore.putIfAbsent(
                RevocationKeys.token(claims.tokenId()),
                claims.revocationTtl(clock.instant(), properties.clockSkew()));
        if (!firstUse) {
            log.warn("SECURITY: Password reset token {} presented again for subject {}",
                    claims.tokenId(), claims.subjectId());
            throw new TokenRevokedException();
        }
        return claims.subjectId();
    }
}
