package com.example.authservice.service;

import com.example.authservice.entity.User;
import com.example.authservice.support.AuthFixture;
import com.example.authservice.token.TokenPair;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RefreshTokenCleanupJobTest {

    @Test
    void purgesOnlyRecordsExpiredBeyondRetention() {
        AuthFixture fixture = new AuthFixture();
        User user = fixture.createUser("a@b.com", "Passw0rd!", "user");
        fixture.tokenIssuer.issuePair(user);

        fixture.clock.advance(Duration.ofDays(7).plusHours(12));
        TokenPair fresh = fixture.tokenIssuer.issuePair(user);
        RefreshTokenCleanupJob job = new RefreshTokenCleanupJob(fixture.refreshTokens, fixture.clock);

        job.purgeExpired();
        assertEquals(2, fixture.refreshTokens.size());

        fixture.clock.advance(Duration.ofDays(1));
        job.purgeExpired();

        assertEquals(1, fixture.refreshTokens.size());
        assertEquals(1, fixture.refreshTokens.family(fresh.refreshClaims().familyId()).size());
    }
}
