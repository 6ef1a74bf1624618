package com.example.authservice.service;

import com.example.authservice.entity.User;
import com.example.authservice.exception.MalformedTokenException;
import com.example.authservice.exception.TokenExpiredException;
import com.example.authservice.exception.TokenRevokedException;
import com.example.authservice.revocation.RevocationKeys;
import com.example.authservice.support.AuthFixture;
import com.example.authservice.token.TokenClaims;
import com.example.authservice.token.TokenType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class PasswordResetTokenServiceTest {

    private AuthFixture fixture;
    private PasswordResetTokenService service;
    private User user;

    @BeforeEach
    void setUp() {
        fixture = new AuthFixture();
        service = fixture.passwordResetTokenService;
        user = fixture.createUser("a@b.com", "Passw0rd!", "user");
    }

    @Test
    void issuedTokenIsPurposeScoped() {
        TokenClaims claims = fixture.jwtService.decode(service.issue(user));

        assertEquals(TokenType.PASSWORD_RESET, claims.type());
        assertEquals(PasswordResetTokenService.PURPOSE, claims.purpose());
        assertEquals(Duration.ofMinutes(15), Duration.between(claims.issuedAt(), claims.expiresAt()));
    }

    @Test
    void tokenCanBeConsumedOnlyOnce() {
        String token = service.issue(user);

        assertEquals(user.getId(), service.consume(token));
        assertThrows(TokenRevokedException.class, () -> service.consume(token));
    }

    @Test
    void consumptionIsRecordedUntilTokenStopsVerifying() {
        String token = service.issue(user);
        TokenClaims claims = fixture.jwtService.decode(token);
        fixture.clock.advance(Duration.ofMinutes(5));

        service.consume(token);

        assertEquals(claims.expiresAt().plus(fixture.properties.clockSkew()),
                fixture.revocations.expiryOf(RevocationKeys.token(claims.tokenId())));
    }

    @Test
    void tokenConsumedJustBeforeExpiryStaysConsumedWithinClockSkew() {
        String token = service.issue(user);
        fixture.clock.advance(Duration.ofMinutes(15).minusSeconds(5));
        assertEquals(user.getId(), service.consume(token));

        // past exp, still accepted by the decoder because of the skew tolerance
        fixture.clock.advance(Duration.ofSeconds(10));

        assertThrows(TokenRevokedException.class, () -> service.consume(token));
    }

    @Test
    void expiredTokenIsRejected() {
        String token = service.issue(user);

        fixture.clock.advance(Duration.ofMinutes(16));

        assertThrows(TokenExpiredException.class, () -> service.consume(token));
    }

    @Test
    void accessTokenIsNotAResetToken() {
        String accessToken = fixture.tokenIssuer.issuePair(user).accessToken();

        assertThrows(MalformedTokenException.class, () -> service.consume(accessToken));
    }
}
