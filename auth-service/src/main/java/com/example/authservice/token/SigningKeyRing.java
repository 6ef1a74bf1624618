package com.example.authservice.token;

import com.example.authservice.config.TokenProperties;
import io.jsonwebtoken.JwsHeader;
import io.jsonwebtoken.LocatorAdapter;
import io.jsonwebtoken.security.Keys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered set of HMAC signing keys, loaded once at startup.
 *
 * The first key ({@code jwt.secret}) signs new tokens. Keys from
 * {@code jwt.previous-secrets} only verify tokens issued before a rotation.
 * The key id ({@code kid} header) is the first 8 hex chars of SHA-256(secret).
 */
@Component
public class SigningKeyRing extends LocatorAdapter<Key> {

    private static final Logger log = LoggerFactory.getLogger(SigningKeyRing.class);

    // HS256 requires at least 256 bits
    static final int MIN_SECRET_BYTES = 32;

    private final Map<String, SecretKey> keysById;
    private final String signingKeyId;

    public SigningKeyRing(TokenProperties properties) {
        List<String> secrets = new ArrayList<>();
        secrets.add(properties.secret());
        properties.previousSecrets().stream()
                .filter(s -> s != null && !s.isBlank())
                .forEach(secrets::add);

        Map<String, SecretKey> keys = new LinkedHashMap<>();
        for (String secret : secrets) {
            byte[] material = requireStrong(secret);
            keys.putIfAbsent(keyId(material), Keys.hmacShaKeyFor(material));
        }
        this.keysById = Collections.unmodifiableMap(keys);
        this.signingKeyId = keys.keySet().iterator().next();

        log.info("Loaded {} JWT signing key(s), signing with kid {}", keysById.size(), signingKeyId);
    }

    public SecretKey signingKey() {
        return keysById.get(signingKeyId);
    }

    public String signingKeyId() {
        return signingKeyId;
    }

    /**
     * Unknown or absent kid falls back to the signing key, so verification fails as a signature mismatch.
     */
    @Override
    protected Key locate(JwsHeader header) {
        String kid = header.getKeyId();
        if (kid == null) {
            return signingKey();
        }
        return keysById.getOrDefault(kid, signingKey());
    }

    static String keyId(byte[] material) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(material);
            return HexFormat.of().formatHex(digest).substring(0, 8);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static byte[] requireStrong(String secret) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("jwt.secret must be configured");
        }
        byte[] material = secret.getBytes(StandardCharsets.UTF_8);
        if (material.length < MIN_SECRET_BYTES) {
            throw new IllegalStateException("JWT secrets must be at least " + MIN_SECRET_BYTES + " bytes");
        }
        return material;
    }
}
