package com.example.authservice.revocation;

import com.example.authservice.token.TokenClaims;

import java.time.Duration;
import java.util.Collection;

/**
 * Fast-lookup blacklist. A present key means "invalid", whatever the signature
 * and expiry checks said. Entries live only as long as the tokens they cover.
 *
 * Implementations fail closed: when the backing store cannot answer they throw
 * {@link com.example.authservice.exception.UpstreamUnavailableException}.
 */
public interface RevocationStore {

    /**
     * Insert {@code key} with a TTL. Non-positive TTLs are ignored.
     */
    void put(String key, Duration ttl);

    /**
     * Insert {@code key} only if absent.
     *
     * @return true if this call inserted the key
     */
    boolean putIfAbsent(String key, Duration ttl);

    boolean exists(String key);

    /**
     * Single round trip over several keys.
     */
    boolean anyExists(Collection<String> keys);

    default void revokeToken(String tokenId, Duration ttl) {
        put(RevocationKeys.token(tokenId), ttl);
    }

    default void revokeFamily(String familyId, Duration ttl) {
        put(RevocationKeys.family(familyId), ttl);
    }

    default boolean isRevoked(TokenClaims claims) {
        return anyExists(RevocationKeys.forClaims(claims));
    }
}
