package com.example.authservice.token;

import com.example.authservice.config.TokenProperties;
import com.example.authservice.exception.InvalidSignatureException;
import com.example.authservice.exception.MalformedTokenException;
import com.example.authservice.exception.TokenExpiredException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtBuilder;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.SecurityException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Date;

/**
 * JWT Service: the claims codec.
 *
 * Algorithm: HS256, compact JWS with {@code typ=JWT} and {@code kid} headers.
 * Signature is verified before expiry, so a tampered expired token reports
 * {@link InvalidSignatureException}, never {@link TokenExpiredException}.
 */
@Service
public class JwtService {

    public static final String CLAIM_EMAIL = "email";
    public static final String CLAIM_ROLE = "role";
    public static final String CLAIM_FAMILY = "fid";
    public static final String CLAIM_TYPE = "type";
    public static final String CLAIM_PURPOSE = "purpose";

    private final SigningKeyRing keyRing;
    private final JwtParser parser;
    private final String issuer;

    public JwtService(SigningKeyRing keyRing, TokenProperties properties, Clock clock) {
        this.keyRing = keyRing;
        this.issuer = properties.issuer();
        this.parser = Jwts.parser()
                .keyLocator(keyRing)
                .requireIssuer(properties.issuer())
                .clockSkewSeconds(properties.clockSkew().getSeconds())
                .clock(() -> Date.from(clock.instant()))
                .build();
    }

    /**
     * Sign a claim set with the current key.
     */
    public String encode(TokenClaims claims) {
        JwtBuilder builder = Jwts.builder()
                .header().keyId(keyRing.signingKeyId()).type("JWT").and()
                .id(claims.tokenId())
                .subject(String.valueOf(claims.subjectId()))
                .issuer(issuer)
                .issuedAt(Date.from(claims.issuedAt()))
                .expiration(Date.from(claims.expiresAt()))
                .claim(CLAIM_TYPE, claims.type().claimValue());

        if (claims.email() != null) {
            builder.claim(CLAIM_EMAIL, claims.email());
        }
        if (claims.role() != null) {
            builder.claim(CLAIM_ROLE, claims.role());
        }
        if (claims.familyId() != null) {
            builder.claim(CLAIM_FAMILY, claims.familyId());
        }
        if (claims.purpose() != null) {
            builder.claim(CLAIM_PURPOSE, claims.purpose());
        }

        return builder.signWith(keyRing.signingKey(), Jwts.SIG.HS256).compact();
    }

    /**
     * Verify signature and expiry, then map the payload.
     *
     * @throws InvalidSignatureException tampered, foreign key or unknown kid
     * @throws TokenExpiredException     past {@code exp} beyond the clock skew
     * @throws MalformedTokenException   anything structurally wrong, including unsigned tokens
     */
    public TokenClaims decode(String token) {
        if (token == null || token.isBlank()) {
            throw new MalformedTokenException("Token missing");
        }

        try {
            return toClaims(parser.parseSignedClaims(token).getPayload());
        } catch (ExpiredJwtException e) {
            throw new TokenExpiredException();
        } catch (SecurityException e) {
            throw new InvalidSignatureException();
        } catch (JwtException | IllegalArgumentException e) {
            throw new MalformedTokenException("Token malformed");
        }
    }

    private TokenClaims toClaims(Claims payload) {
        String tokenId = payload.getId();
        String subject = payload.getSubject();
        Date issuedAt = payload.getIssuedAt();
        Date expiration = payload.getExpiration();
        if (tokenId == null || subject == null || issuedAt == null || expiration == null) {
            throw new MalformedTokenException("Token malformed");
        }

        // non-numeric sub surfaces as NumberFormatException, mapped to malformed by decode
        Long subjectId = Long.valueOf(subject);
        TokenType type = TokenType.fromClaim(payload.get(CLAIM_TYPE, String.class));

        return new TokenClaims(
                tokenId,
                subjectId,
                payload.get(CLAIM_EMAIL, String.class),
                payload.get(CLAIM_ROLE, String.class),
                payload.get(CLAIM_FAMILY, String.class),
                type,
                payload.get(CLAIM_PURPOSE, String.class),
                issuedAt.toInstant(),
                expiration.toInstant());
    }
}
