package com.example.authservice.service;

import com.example.authservice.entity.User;
import com.example.authservice.exception.ForbiddenException;
import com.example.authservice.exception.MalformedTokenException;
import com.example.authservice.exception.TokenRevokedException;
import com.example.authservice.exception.UpstreamUnavailableException;
import com.example.authservice.revocation.RevocationKeys;
import com.example.authservice.support.AuthFixture;
import com.example.authservice.token.TokenClaims;
import com.example.authservice.token.TokenPair;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class AuthorizationResolverTest {

    private AuthFixture fixture;
    private AuthorizationResolver resolver;

    @BeforeEach
    void setUp() {
        fixture = new AuthFixture();
        resolver = fixture.authorizationResolver;
    }

    private TokenPair loginAs(String role) {
        User user = fixture.createUser(role + "@example.com", "Passw0rd!", role);
        return fixture.tokenIssuer.issuePair(user);
    }

    @Test
    void grantedPermissionReturnsClaims() {
        TokenPair pair = loginAs("user");

        TokenClaims claims = resolver.authorize(pair.accessToken(), "read:self");

        assertEquals("user", claims.role());
        assertEquals(pair.accessClaims().tokenId(), claims.tokenId());
    }

    @Test
    void missingPermissionIsForbidden() {
        TokenPair pair = loginAs("user");

        ForbiddenException ex = assertThrows(ForbiddenException.class,
                () -> resolver.authorize(pair.accessToken(), "documents:write"));
        assertEquals("documents:write", ex.getPermission());
    }

    @Test
    void adminSatisfiesEveryPermission() {
        TokenPair pair = loginAs("admin");

        assertDoesNotThrow(() -> resolver.authorize(pair.accessToken(), "anything:at-all"));
    }

    @Test
    void unknownRoleGrantsNothing() {
        TokenPair pair = loginAs("ghost");

        assertThrows(ForbiddenException.class, () -> resolver.authorize(pair.accessToken(), "read:self"));
        assertFalse(resolver.hasPermission(null, "read:self"));
    }

    @Test
    void refreshTokenIsNotAnAccessToken() {
        TokenPair pair = loginAs("user");

        assertThrows(MalformedTokenException.class, () -> resolver.authenticate(pair.refreshToken()));
    }

    @Test
    void blacklistedTokenIdIsRevoked() {
        TokenPair pair = loginAs("user");
        fixture.revocations.revokeToken(pair.accessClaims().tokenId(), Duration.ofMinutes(60));

        assertThrows(TokenRevokedException.class, () -> resolver.authenticate(pair.accessToken()));
    }

    @Test
    void blacklistedFamilyRevokesAccessToken() {
        TokenPair pair = loginAs("user");
        fixture.revocations.put(RevocationKeys.family(pair.accessClaims().familyId()), Duration.ofDays(7));

        assertThrows(TokenRevokedException.class, () -> resolver.authenticate(pair.accessToken()));
    }

    @Test
    void blacklistEntryExpiresWithTheToken() {
        TokenPair pair = loginAs("user");
        fixture.revocations.revokeToken(pair.accessClaims().tokenId(), Duration.ofMinutes(10));

        fixture.clock.advance(Duration.ofMinutes(11));

        assertDoesNotThrow(() -> resolver.authenticate(pair.accessToken()));
    }

    @Test
    void blacklistOutageFailsClosed() {
        TokenPair pair = loginAs("user");
        fixture.revocations.setUnavailable(true);

        assertThrows(UpstreamUnavailableException.class, () -> resolver.authenticate(pair.accessToken()));
    }
}
