package com.example.authservice.store.jpa;

import com.example.authservice.entity.RefreshToken;
import com.example.authservice.repository.RefreshTokenRepository;
import com.example.authservice.store.RefreshTokenStore;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * {@link RefreshTokenStore} backed by the refresh_tokens table.
 * Write methods join the caller's transaction when there is one.
 */
@Component
public class JpaRefreshTokenStore implements RefreshTokenStore {

    private static final String STORE = "Refresh token store";

    private final RefreshTokenRepository refreshTokenRepository;
    private final Clock clock;

    public JpaRefreshTokenStore(RefreshTokenRepository refreshTokenRepository, Clock clock) {
        this.refreshTokenRepository = refreshTokenRepository;
        this.clock = clock;
    }

    @Override
    @Transactional
    public void create(RefreshToken record) {
        StoreCalls.run(STORE, () -> refreshTokenRepository.save(record));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<RefreshToken> findByHash(String tokenHash) {
        return StoreCalls.guard(STORE, () -> refreshTokenRepository.findByTokenHash(tokenHash));
    }

    @Override
    @Transactional
    public boolean revokeIfLatest(String familyId, String tokenId, String replacedBy) {
        int updated = StoreCalls.guard(STORE,
                () -> refreshTokenRepository.revokeIfLatest(familyId, tokenId, replacedBy, clock.instant()));
        return updated == 1;
    }

    @Override
    @Transactional
    public int revokeFamily(String familyId) {
        return StoreCalls.guard(STORE, () -> refreshTokenRepository.revokeFamily(familyId, clock.instant()));
    }

    @Override
    @Transactional(readOnly = true)
    public List<String> findActiveFamilies(Long subjectId) {
        return StoreCalls.guard(STORE, () -> refreshTokenRepository.findActiveFamilies(subjectId, clock.instant()));
    }

    @Override
    @Transactional
    public int deleteExpiredBefore(Instant cutoff) {
        return StoreCalls.guard(STORE, () -> refreshTokenRepository.deleteExpiredBefore(cutoff));
    }
}
