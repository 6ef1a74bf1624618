package com.example.authservice.revocation;

import com.example.authservice.token.TokenClaims;

import java.util.ArrayList;
import java.util.List;

/**
 * Blacklist key layout:
 * <pre>
 * blacklist:token:{jti}   a single token
 * blacklist:family:{fid}  every token of a login session
 * </pre>
 */
public final class RevocationKeys {

    public static final String TOKEN_PREFIX = "blacklist:token:";
    public static final String FAMILY_PREFIX = "blacklist:family:";

    private RevocationKeys() {
    }

    public static String token(String tokenId) {
        return TOKEN_PREFIX + tokenId;
    }

    public static String family(String familyId) {
        return FAMILY_PREFIX + familyId;
    }

    /**
     * Keys that invalidate the given token: its own id and, when present, its family.
     */
    public static List<String> forClaims(TokenClaims claims) {
        List<String> keys = new ArrayList<>(2);
        keys.add(token(claims.tokenId()));
        if (claims.familyId() != null) {
            keys.add(family(claims.familyId()));
        }
        return keys;
    }
}
