package com.example.authservice.store.jpa;

import com.example.authservice.config.ClockConfig;
import com.example.authservice.entity.RefreshToken;
import com.example.authservice.repository.RefreshTokenRepository;
import com.example.authservice.token.TokenHashes;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.TestPropertySource;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Conditional-update semantics of the refresh record table on H2.
 */
@DataJpaTest
@Import({JpaRefreshTokenStore.class, ClockConfig.class})
@TestPropertySource(properties = {
    "spring.jpa.hibernate.ddl-auto=create-drop",
    "jwt.secret=test-signing-secret-0123456789-abcdef"
})
class JpaRefreshTokenStoreTest {

    @Autowired
    private JpaRefreshTokenStore store;

    @Autowired
    private RefreshTokenRepository repository;

    private RefreshToken record(String tokenId, Long subjectId, String familyId, Instant expiresAt) {
        RefreshToken record = new RefreshToken();
        record.setTokenId(tokenId);
        record.setSubjectId(subjectId);
        record.setFamilyId(familyId);
        record.setTokenHash(TokenHashes.sha256Hex("raw-" + tokenId));
        record.setExpiresAt(expiresAt);
        return record;
    }

    private Instant inDays(long days) {
        return Instant.now().plus(days, ChronoUnit.DAYS);
    }

    @Test
    void findByHashReturnsStoredRecord() {
        store.create(record("t1", 1L, "f1", inDays(7)));

        RefreshToken found = store.findByHash(TokenHashes.sha256Hex("raw-t1")).orElseThrow();

        assertEquals("t1", found.getTokenId());
        assertFalse(found.isRevoked());
        assertNotNull(found.getCreatedAt());
    }

    @Test
    void revokeIfLatestSucceedsOnlyOnce() {
        store.create(record("t1", 1L, "f1", inDays(7)));

        assertTrue(store.revokeIfLatest("f1", "t1", "t2"));
        assertFalse(store.revokeIfLatest("f1", "t1", "t3"));

        RefreshToken consumed = repository.findByTokenHash(TokenHashes.sha256Hex("raw-t1")).orElseThrow();
        assertTrue(consumed.isSuperseded());
        assertEquals("t2", consumed.getReplacedBy());
        assertNotNull(consumed.getRevokedAt());
    }

    @Test
    void revokeIfLatestIgnoresOtherFamilies() {
        store.create(record("t1", 1L, "f1", inDays(7)));

        assertFalse(store.revokeIfLatest("other", "t1", "t2"));
    }

    @Test
    void revokeFamilyRevokesOnlyLiveRecordsOfThatFamily() {
        store.create(record("t1", 1L, "f1", inDays(7)));
        store.create(record("t2", 1L, "f1", inDays(7)));
        store.create(record("t3", 1L, "f2", inDays(7)));
        store.revokeIfLatest("f1", "t1", "t2");

        assertEquals(1, store.revokeFamily("f1"));
        assertEquals(List.of("f2"), store.findActiveFamilies(1L));
    }

    @Test
    void findActiveFamiliesSkipsExpiredRecords() {
        store.create(record("t1", 1L, "f1", inDays(7)));
        store.create(record("t2", 1L, "f2", inDays(-1)));
        store.create(record("t3", 2L, "f3", inDays(7)));

        assertEquals(List.of("f1"), store.findActiveFamilies(1L));
    }

    @Test
    void deleteExpiredBeforeRemovesOldRecords() {
        store.create(record("t1", 1L, "f1", inDays(-3)));
        store.create(record("t2", 1L, "f2", inDays(7)));

        assertEquals(1, store.deleteExpiredBefore(inDays(-1)));
        assertEquals(1, repository.count());
    }
}
