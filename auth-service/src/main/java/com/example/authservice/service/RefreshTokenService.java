package com.example.authservice.service;

import com.example.authservice.config.TokenProperties;
import com.example.authservice.entity.RefreshToken;
import com.example.authservice.entity.User;
import com.example.authservice.exception.MalformedTokenException;
import com.example.authservice.exception.TokenExpiredException;
import com.example.authservice.exception.TokenReuseDetectedException;
import com.example.authservice.exception.TokenRevokedException;
import com.example.authservice.exception.UpstreamUnavailableException;
import com.example.authservice.revocation.RevocationKeys;
import com.example.authservice.revocation.RevocationStore;
import com.example.authservice.store.PrincipalStore;
import com.example.authservice.store.RefreshTokenStore;
import com.example.authservice.token.JwtService;
import com.example.authservice.token.TokenClaims;
import com.example.authservice.token.TokenHashes;
import com.example.authservice.token.TokenIssuer;
import com.example.authservice.token.TokenPair;
import com.example.authservice.token.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Clock;
import java.util.List;

/**
 * Refresh Token Service: rotation with reuse detection.
 *
 * A refresh token is good for exactly one rotation. Consuming it and storing its
 * successor happen in one transaction guarded by a conditional update, so among
 * concurrent rotations of the same token exactly one succeeds. Presenting a
 * superseded token revokes the whole family (the login session).
 *
 * Not @Transactional as a whole: a family revocation must stay committed even
 * though the call ends in an exception.
 */
@Service
public class RefreshTokenService {

    private static final Logger log = LoggerFactory.getLogger(RefreshTokenService.class);

    private final JwtService jwtService;
    private final TokenIssuer tokenIssuer;
    private final RefreshTokenStore refreshTokenStore;
    private final PrincipalStore principalStore;
    private final RevocationStore revocationStore;
    private final AuditService auditService;
    private final TransactionOperations transactionOperations;
    private final TokenProperties properties;
    private final Clock clock;

    public RefreshTokenService(
            JwtService jwtService,
            TokenIssuer tokenIssuer,
            RefreshTokenStore refreshTokenStore,
            PrincipalStore principalStore,
            RevocationStore revocationStore,
            AuditService auditService,
            TransactionOperations transactionOperations,
            TokenProperties properties,
            Clock clock) {
        this.jwtService = jwtService;
        this.tokenIssuer = tokenIssuer;
        this.refreshTokenStore = refreshTokenStore;
        this.principalStore = principalStore;
        this.revocationStore = revocationStore;
        this.auditService = auditService;
        this.transactionOperations = transactionOperations;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Exchange a refresh token for a new pair in the same family.
     *
     * Steps:
     * 1. Decode and verify, type must be refresh
     * 2. Blacklist check on {jti, fid}
     * 3. Look up the durable record by hash
     * 4. Reuse detection, then revoked/expired checks
     * 5. Principal must still exist and be active
     * 6. Conditional revoke + successor insert in one transaction
     * 7. Blacklist the consumed jti until it stops verifying (best effort)
     *
     * @throws TokenReuseDetectedException superseded token presented (family revoked)
     * @throws TokenRevokedException       revoked, unknown, or principal gone
     * @throws TokenExpiredException       past expiry
     */
    public TokenPair rotate(String refreshToken) {
        // Step 1
        TokenClaims claims = jwtService.decode(refreshToken).requireType(TokenType.REFRESH);
        if (claims.familyId() == null) {
            throw new MalformedTokenException("Token malformed");
        }

        // Step 2: one round trip on the common path
        boolean tokenBlacklisted = false;
        if (revocationStore.isRevoked(claims)) {
            if (revocationStore.exists(RevocationKeys.family(claims.familyId()))) {
                throw new TokenRevokedException();
            }
            tokenBlacklisted = true;
        }

        // Step 3
        RefreshToken record = refreshTokenStore.findByHash(TokenHashes.sha256Hex(refreshToken))
                .orElseThrow(TokenRevokedException::new);

        // Step 4
        if (record.isSuperseded()) {
            throw reuseDetected(claims);
        }
        if (record.isRevoked() || tokenBlacklisted) {
            throw new TokenRevokedException();
        }
        if (record.isExpiredAt(clock.instant())) {
            throw new TokenExpiredException();
        }

        // Step 5: role is re-read here, so role changes apply from this rotation on
        User user = principalStore.findById(claims.subjectId())
                .filter(User::isActive)
                .orElse(null);
        if (user == null) {
            log.warn("SECURITY: Refresh for missing or inactive subject {}. Revoking family {}.",
                    claims.subjectId(), claims.familyId());
            revokeFamily(claims.familyId());
            throw new TokenRevokedException();
        }

        // Step 6
        TokenPair next = tokenIssuer.prepareRotation(claims, user);
        Boolean won = transactionOperations.execute(status -> {
            if (!refreshTokenStore.revokeIfLatest(claims.familyId(), claims.tokenId(), next.refreshClaims().tokenId())) {
                return false;
            }
            refreshTokenStore.create(tokenIssuer.toRecord(next));
            return true;
        });
        if (!Boolean.TRUE.equals(won)) {
            // lost the race to a concurrent rotation of the same token
            throw reuseDetected(claims);
        }

        // Step 7: the superseded record already rejects the consumed token, so a failed write is not fatal
        try {
            revocationStore.revokeToken(claims.tokenId(),
                    claims.revocationTtl(clock.instant(), properties.clockSkew()));
        } catch (UpstreamUnavailableException e) {
            log.warn("Blacklist write for consumed refresh token {} failed, durable record still rejects it: {}",
                    claims.tokenId(), e.getMessage());
        }

        auditService.logRefreshSuccess(user.getId(), claims.familyId());
        log.info("Rotated refresh token {} -> {} in family {}",
                claims.tokenId(), next.refreshClaims().tokenId(), claims.familyId());

        return next;
    }

    /**
     * Revoke every token of a login session: durable records first, then the
     * family blacklist entry (kept for the refresh TTL plus clock skew, the longest a family member verifies).
     */
    public void revokeFamily(String familyId) {
        refreshTokenStore.revokeFamily(familyId);
        revocationStore.revokeFamily(familyId, properties.refreshTokenTtl().plus(properties.clockSkew()));
    }

    /**
     * Revoke every active session of a subject (logout-all, password reset/change).
     *
     * @return number of families revoked
     */
    public int revokeAllSessions(Long subjectId) {
        List<String> families = refreshTokenStore.findActiveFamilies(subjectId);
        families.forEach(this::revokeFamily);
        log.info("Revoked {} session(s) of subject {}", families.size(), subjectId);
        return families.size();
    }

    private TokenReuseDetectedException reuseDetected(TokenClaims claims) {
        log.warn("SECURITY: Refresh token reuse detected for subject {} (token {}). Revoking family {}.",
                claims.subjectId(), claims.tokenId(), claims.familyId());
        revokeFamily(claims.familyId());
        auditService.logRefreshReuse(claims.subjectId(), claims.familyId(), claims.tokenId());
        return new TokenReuseDetectedException();
    }
}
