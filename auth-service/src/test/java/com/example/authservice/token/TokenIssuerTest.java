package com.example.authservice.token;

import com.example.authservice.entity.RefreshToken;
import com.example.authservice.entity.User;
import com.example.authservice.support.AuthFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TokenIssuerTest {

    private AuthFixture fixture;
    private User user;

    @BeforeEach
    void setUp() {
        fixture = new AuthFixture();
        user = fixture.createUser("a@b.com", "Passw0rd!", "user");
    }

    @Test
    void issuePairBuildsDistinctAccessAndRefreshClaims() {
        TokenPair pair = fixture.tokenIssuer.issuePair(user);

        TokenClaims access = fixture.jwtService.decode(pair.accessToken());
        TokenClaims refresh = fixture.jwtService.decode(pair.refreshToken());

        assertEquals(TokenType.ACCESS, access.type());
        assertEquals(TokenType.REFRESH, refresh.type());
        assertNotEquals(access.tokenId(), refresh.tokenId());
        assertEquals(access.familyId(), refresh.familyId());
        assertEquals("user", access.role());
        assertNull(refresh.role());
        assertEquals(3600, pair.expiresIn());
        assertEquals(Duration.ofMinutes(60), Duration.between(access.issuedAt(), access.expiresAt()));
        assertEquals(Duration.ofDays(7), Duration.between(refresh.issuedAt(), refresh.expiresAt()));
    }

    @Test
    void issuePairPersistsHashedRefreshRecord() {
        TokenPair pair = fixture.tokenIssuer.issuePair(user);

        List<RefreshToken> family = fixture.refreshTokens.family(pair.refreshClaims().familyId());
        assertEquals(1, family.size());

        RefreshToken record = family.get(0);
        assertEquals(pair.refreshClaims().tokenId(), record.getTokenId());
        assertEquals(TokenHashes.sha256Hex(pair.refreshToken()), record.getTokenHash());
        assertNotEquals(pair.refreshToken(), record.getTokenHash());
        assertFalse(record.isRevoked());
        assertEquals(user.getId(), record.getSubjectId());
    }

    @Test
    void everyLoginOpensANewFamily() {
        TokenPair first = fixture.tokenIssuer.issuePair(user);
        TokenPair second = fixture.tokenIssuer.issuePair(user);

        assertNotEquals(first.refreshClaims().familyId(), second.refreshClaims().familyId());
    }

    @Test
    void prepareRotationKeepsFamilyAndDoesNotPersist() {
        TokenPair first = fixture.tokenIssuer.issuePair(user);
        user.setRoleName("editor");

        TokenPair next = fixture.tokenIssuer.prepareRotation(first.refreshClaims(), user);

        assertEquals(first.refreshClaims().familyId(), next.refreshClaims().familyId());
        assertEquals("editor", next.accessClaims().role());
        assertEquals(1, fixture.refreshTokens.size());
    }
}
