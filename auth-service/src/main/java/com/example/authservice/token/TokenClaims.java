package com.example.authservice.token;

import com.example.authservice.exception.MalformedTokenException;

import java.time.Duration;
import java.time.Instant;

/**
 * Decoded (or to-be-encoded) claim set of a token.
 * Fields that do not apply to a token type are null.
 *
 * @param tokenId   {@code jti}
 * @param subjectId {@code sub}
 * @param email     {@code email} (access and reset tokens)
 * @param role      {@code role}, snapshotted at issuance (access tokens)
 * @param familyId  {@code fid}, the login session (access and refresh tokens)
 * @param type      {@code type}
 * @param purpose   {@code purpose} (reset tokens)
 * @param issuedAt  {@code iat}
 * @param expiresAt {@code exp}
 */
public record TokenClaims(
        String tokenId,
        Long subjectId,
        String email,
        String role,
        String familyId,
        TokenType type,
        String purpose,
        Instant issuedAt,
        Instant expiresAt) {

    public static TokenClaims access(String tokenId, Long subjectId, String email, String role,
                                     String familyId, Instant issuedAt, Instant expiresAt) {
        return new TokenClaims(tokenId, subjectId, email, role, familyId, TokenType.ACCESS, null, issuedAt, expiresAt);
    }

    public static TokenClaims refresh(String tokenId, Long subjectId, String familyId,
                                      Instant issuedAt, Instant expiresAt) {
        return new TokenClaims(tokenId, subjectId, null, null, familyId, TokenType.REFRESH, null, issuedAt, expiresAt);
    }

    public static TokenClaims passwordReset(String tokenId, Long subjectId, String email, String purpose,
                                            Instant issuedAt, Instant expiresAt) {
        return new TokenClaims(tokenId, subjectId, email, null, null, TokenType.PASSWORD_RESET, purpose,
                issuedAt, expiresAt);
    }

    /**
     * @throws MalformedTokenException if the token is of another kind
     */
    public TokenClaims requireType(TokenType expected) {
        if (type != expected) {
            throw new MalformedTokenException("Unexpected token type");
        }
        return this;
    }

    /**
     * How long a blacklist entry for this token must live: the token keeps verifying
     * until {@code exp + clockSkew}, so the entry covers the same window. Zero once that has passed.
     */
    public Duration revocationTtl(Instant now, Duration clockSkew) {
        Duration remaining = Duration.between(now, expiresAt.plus(clockSkew));
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }
}
