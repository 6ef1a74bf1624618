package com.example.authservice.token;

import com.example.authservice.config.TokenProperties;
import com.example.authservice.entity.RefreshToken;
import com.example.authservice.entity.User;
import com.example.authservice.store.RefreshTokenStore;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

/**
 * Mints access/refresh token pairs.
 *
 * Every token gets a fresh random UUID as {@code jti}. A login opens a new
 * family ({@code fid}); rotation keeps the family of the consumed token.
 */
@Service
public class TokenIssuer {

    private final JwtService jwtService;
    private final RefreshTokenStore refreshTokenStore;
    private final TokenProperties properties;
    private final Clock clock;

    public TokenIssuer(JwtService jwtService, RefreshTokenStore refreshTokenStore,
                       TokenProperties properties, Clock clock) {
        this.jwtService = jwtService;
        this.refreshTokenStore = refreshTokenStore;
        this.properties = properties;
        this.clock = clock;
    }

    public TokenPair issuePair(User user) {
        return issuePair(user.getId(), user.getEmail(), user.getRoleName());
    }

    /**
     * Issue a pair for a new login session and persist its refresh record.
     */
    public TokenPair issuePair(Long subjectId, String email, String role) {
        TokenPair pair = buildPair(subjectId, email, role, UUID.randomUUID().toString());
        refreshTokenStore.create(toRecord(pair));
        return pair;
    }

    /**
     * Build the successor of a consumed refresh token. Nothing is persisted;
     * the caller stores {@link #toRecord(TokenPair)} in the rotation transaction.
     * The role is read from the current principal, not from the old token.
     */
    public TokenPair prepareRotation(TokenClaims consumed, User user) {
        return buildPair(user.getId(), user.getEmail(), user.getRoleName(), consumed.familyId());
    }

    public RefreshToken toRecord(TokenPair pair) {
        TokenClaims claims = pair.refreshClaims();

        RefreshToken record = new RefreshToken();
        record.setTokenId(claims.tokenId());
        record.setSubjectId(claims.subjectId());
        record.setFamilyId(claims.familyId());
        record.setTokenHash(TokenHashes.sha256Hex(pair.refreshToken()));
        record.setExpiresAt(claims.expiresAt());
        record.setRevoked(false);
        record.setCreatedAt(claims.issuedAt());
        return record;
    }

    private TokenPair buildPair(Long subjectId, String email, String role, String familyId) {
        // JWT timestamps carry whole seconds
        Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);

        TokenClaims access = TokenClaims.access(
                UUID.randomUUID().toString(), subjectId, email, role, familyId,
                now, now.plus(properties.accessTokenTtl()));
        TokenClaims refresh = TokenClaims.refresh(
                UUID.randomUUID().toString(), subjectId, familyId,
                now, now.plus(properties.refreshTokenTtl()));

        return new TokenPair(
                jwtService.encode(access),
                jwtService.encode(refresh),
                properties.accessTokenTtl().getSeconds(),
                access,
                refresh);
    }
}
