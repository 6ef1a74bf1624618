package com.example.authservice.repository;

import com.example.authservice.entity.RefreshToken;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository for RefreshToken entity.
 */
@Repository
public interface RefreshTokenRepository extends JpaRepository<RefreshToken, Long> {

    /**
     * Find refresh token record by SHA-256 hash of the token material.
     */
    Optional<RefreshToken> findByTokenHash(String tokenHash);

    /**
     * Conditional revoke used by rotation.
     * Only the family's current (non-revoked) record can match, so exactly one
     * concurrent caller sees 1 updated row.
     *
     * @return number of updated rows (0 or 1)
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE RefreshToken rt SET rt.revoked = true, rt.replacedBy = :replacedBy, rt.revokedAt = :now " +
           "WHERE rt.familyId = :familyId AND rt.tokenId = :tokenId AND rt.revoked = false")
    int revokeIfLatest(@Param("familyId") String familyId,
                       @Param("tokenId") String tokenId,
                       @Param("replacedBy") String replacedBy,
                       @Param("now") Instant now);

    /**
     * Revoke every live record of a family (reuse detection, logout).
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE RefreshToken rt SET rt.revoked = true, rt.revokedAt = :now " +
           "WHERE rt.familyId = :familyId AND rt.revoked = false")
    int revokeFamily(@Param("familyId") String familyId, @Param("now") Instant now);

    @Query("SELECT DISTINCT rt.familyId FROM RefreshToken rt " +
           "WHERE rt.subjectId = :subjectId AND rt.revoked = false AND rt.expiresAt > :now")
    List<String> findActiveFamilies(@Param("subjectId") Long subjectId, @Param("now") Instant now);

    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM RefreshToken rt WHERE rt.expiresAt < :cutoff")
    int deleteExpiredBefore(@Param("cutoff") Instant cutoff);
}
