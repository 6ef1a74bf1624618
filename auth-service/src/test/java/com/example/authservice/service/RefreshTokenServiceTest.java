package com.example.authservice.service;

import com.example.authservice.entity.RefreshToken;
import com.example.authservice.entity.User;
import com.example.authservice.exception.MalformedTokenException;
import com.example.authservice.exception.TokenExpiredException;
import com.example.authservice.exception.TokenInvalidException;
import com.example.authservice.exception.TokenReuseDetectedException;
import com.example.authservice.exception.TokenRevokedException;
import com.example.authservice.exception.UpstreamUnavailableException;
import com.example.authservice.revocation.RevocationKeys;
import com.example.authservice.support.AuthFixture;
import com.example.authservice.support.InMemoryRevocationStore;
import com.example.authservice.token.TokenClaims;
import com.example.authservice.token.TokenPair;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class RefreshTokenServiceTest {

    private AuthFixture fixture;
    private RefreshTokenService service;
    private User user;

    @BeforeEach
    void setUp() {
        fixture = new AuthFixture();
        service = fixture.refreshTokenService;
        user = fixture.createUser("a@b.com", "Passw0rd!", "user");
    }

    @Test
    void rotateIssuesSuccessorInSameFamily() {
        TokenPair first = fixture.tokenIssuer.issuePair(user);

        TokenPair second = service.rotate(first.refreshToken());

        assertEquals(first.refreshClaims().familyId(), second.refreshClaims().familyId());
        assertNotEquals(first.refreshClaims().tokenId(), second.refreshClaims().tokenId());
        assertNotEquals(first.accessToken(), second.accessToken());
        assertEquals(3600, second.expiresIn());
        verify(fixture.auditService).logRefreshSuccess(user.getId(), first.refreshClaims().familyId());
    }

    @Test
    void rotateMarksConsumedRecordAsSupersededAndBlacklistsItsId() {
        TokenPair first = fixture.tokenIssuer.issuePair(user);

        TokenPair second = service.rotate(first.refreshToken());

        RefreshToken consumed = fixture.refreshTokens.family(first.refreshClaims().familyId()).stream()
                .filter(r -> r.getTokenId().equals(first.refreshClaims().tokenId()))
                .findFirst().orElseThrow();
        assertTrue(consumed.isSuperseded());
        assertEquals(second.refreshClaims().tokenId(), consumed.getReplacedBy());

        String key = RevocationKeys.token(first.refreshClaims().tokenId());
        assertTrue(fixture.revocations.exists(key));
        assertEquals(first.refreshClaims().expiresAt().plus(fixture.properties.clockSkew()),
                fixture.revocations.expiryOf(key));
    }

    @Test
    void replayOfConsumedTokenRevokesWholeFamily() {
        TokenPair first = fixture.tokenIssuer.issuePair(user);
        TokenPair second = service.rotate(first.refreshToken());

        assertThrows(TokenReuseDetectedException.class, () -> service.rotate(first.refreshToken()));

        String familyId = first.refreshClaims().familyId();
        assertTrue(fixture.revocations.exists(RevocationKeys.family(familyId)));
        assertTrue(fixture.refreshTokens.family(familyId).stream().allMatch(RefreshToken::isRevoked));
        assertThrows(TokenRevokedException.class, () -> service.rotate(second.refreshToken()));
        assertThrows(TokenRevokedException.class,
                () -> fixture.authorizationResolver.authenticate(second.accessToken()));
        verify(fixture.auditService).logRefreshReuse(user.getId(), familyId, first.refreshClaims().tokenId());
    }

    @Test
    void replayIsDetectedFromDurableRecordWhenBlacklistEntryIsMissing() {
        TokenPair first = fixture.tokenIssuer.issuePair(user);
        service.rotate(first.refreshToken());
        // simulate a lost blacklist write: only the database knows the token was consumed
        RefreshTokenService withEmptyBlacklist = new RefreshTokenService(fixture.jwtService, fixture.tokenIssuer,
                fixture.refreshTokens, fixture.principals,
                new InMemoryRevocationStore(fixture.clock),
                fixture.auditService, TransactionOperations.withoutTransaction(),
                fixture.properties, fixture.clock);

        assertThrows(TokenReuseDetectedException.class, () -> withEmptyBlacklist.rotate(first.refreshToken()));
    }

    @Test
    void accessTokenCannotBeUsedToRefresh() {
        TokenPair pair = fixture.tokenIssuer.issuePair(user);

        assertThrows(MalformedTokenException.class, () -> service.rotate(pair.accessToken()));
    }

    @Test
    void expiredRefreshTokenIsRejected() {
        TokenPair pair = fixture.tokenIssuer.issuePair(user);

        fixture.clock.advance(Duration.ofDays(8));

        assertThrows(TokenExpiredException.class, () -> service.rotate(pair.refreshToken()));
    }

    @Test
    void signedButUnknownRefreshTokenIsRevoked() {
        Instant now = fixture.clock.instant();
        String orphan = fixture.jwtService.encode(
                TokenClaims.refresh("orphan-jti", user.getId(), "orphan-family", now, now.plus(Duration.ofDays(1))));

        assertThrows(TokenRevokedException.class, () -> service.rotate(orphan));
    }

    @Test
    void inactivePrincipalLosesTheSession() {
        TokenPair pair = fixture.tokenIssuer.issuePair(user);
        user.setActive(false);

        assertThrows(TokenRevokedException.class, () -> service.rotate(pair.refreshToken()));
        assertTrue(fixture.revocations.exists(RevocationKeys.family(pair.refreshClaims().familyId())));
        verify(fixture.auditService, never()).logRefreshSuccess(anyLong(), anyString());
    }

    @Test
    void roleChangeTakesEffectAtRotation() {
        TokenPair pair = fixture.tokenIssuer.issuePair(user);
        user.setRoleName("editor");

        TokenPair rotated = service.rotate(pair.refreshToken());

        assertEquals("user", fixture.jwtService.decode(pair.accessToken()).role());
        assertEquals("editor", fixture.jwtService.decode(rotated.accessToken()).role());
    }

    @Test
    void concurrentRotationsOfOneTokenHaveSingleWinner() throws Exception {
        TokenPair pair = fixture.tokenIssuer.issuePair(user);
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);

        List<Future<TokenPair>> results = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            results.add(executor.submit(() -> {
                start.await();
                return service.rotate(pair.refreshToken());
            }));
        }
        start.countDown();

        int winners = 0;
        int reuse = 0;
        for (Future<TokenPair> result : results) {
            try {
                result.get(10, TimeUnit.SECONDS);
                winners++;
            } catch (ExecutionException e) {
                assertInstanceOf(TokenInvalidException.class, e.getCause());
                if (e.getCause() instanceof TokenReuseDetectedException) {
                    reuse++;
                }
            }
        }
        executor.shutdown();

        assertEquals(1, winners);
        assertTrue(reuse >= 1);
        assertTrue(fixture.refreshTokens.family(pair.refreshClaims().familyId()).stream()
                .allMatch(RefreshToken::isRevoked));
    }

    @Test
    void blacklistOutageFailsClosed() {
        TokenPair pair = fixture.tokenIssuer.issuePair(user);
        fixture.revocations.setUnavailable(true);

        assertThrows(UpstreamUnavailableException.class, () -> service.rotate(pair.refreshToken()));
    }

    @Test
    void failedBlacklistWriteAfterCommitStillReturnsSuccessor() {
        TokenPair first = fixture.tokenIssuer.issuePair(user);
        fixture.revocations.setWritesUnavailable(true);

        TokenPair second = assertDoesNotThrow(() -> service.rotate(first.refreshToken()));

        assertEquals(first.refreshClaims().familyId(), second.refreshClaims().familyId());
        assertFalse(fixture.revocations.exists(RevocationKeys.token(first.refreshClaims().tokenId())));

        fixture.revocations.setWritesUnavailable(false);
        assertThrows(TokenReuseDetectedException.class, () -> service.rotate(first.refreshToken()));
    }

    @Test
    void familyEntryOutlivesEveryMemberIncludingClockSkew() {
        TokenPair pair = fixture.tokenIssuer.issuePair(user);

        service.revokeFamily(pair.refreshClaims().familyId());

        assertEquals(pair.refreshClaims().expiresAt().plus(fixture.properties.clockSkew()),
                fixture.revocations.expiryOf(RevocationKeys.family(pair.refreshClaims().familyId())));
    }

    @Test
    void revokeAllSessionsEndsEveryFamilyOfSubject() {
        TokenPair laptop = fixture.tokenIssuer.issuePair(user);
        TokenPair phone = fixture.tokenIssuer.issuePair(user);

        assertEquals(2, service.revokeAllSessions(user.getId()));

        assertThrows(TokenRevokedException.class, () -> service.rotate(laptop.refreshToken()));
        assertThrows(TokenRevokedException.class, () -> service.rotate(phone.refreshToken()));
        assertThrows(TokenRevokedException.class,
                () -> fixture.authorizationResolver.authenticate(phone.accessToken()));
        verify(fixture.auditService, never()).logRefreshReuse(anyLong(), eq(laptop.refreshClaims().familyId()), anyString());
    }
}
