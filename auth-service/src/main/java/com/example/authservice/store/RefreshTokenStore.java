package com.example.authservice.store;

import com.example.authservice.entity.RefreshToken;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable refresh-token records.
 *
 * Correctness of rotation relies on {@link #revokeIfLatest} being an atomic
 * conditional update: among concurrent callers for the same token exactly one
 * gets {@code true}.
 */
public interface RefreshTokenStore {

    void create(RefreshToken record);

    Optional<RefreshToken> findByHash(String tokenHash);

    /**
     * Revoke {@code tokenId} if it is still the live record of {@code familyId},
     * recording {@code replacedBy} as its successor.
     *
     * @return true if this call performed the revocation
     */
    boolean revokeIfLatest(String familyId, String tokenId, String replacedBy);

    /**
     * @return number of records revoked
     */
    int revokeFamily(String familyId);

    /**
     * Families of a subject that still hold a live, unexpired record.
     */
    List<String> findActiveFamilies(Long subjectId);

    int deleteExpiredBefore(Instant cutoff);
}
