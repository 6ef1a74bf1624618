package com.example.authservice.service;

import com.example.authservice.entity.User;
import com.example.authservice.exception.AuthenticationFailedException;
import com.example.authservice.store.PrincipalStore;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Checks a (principal, secret) pair against the stored hash.
 *
 * Every failure is the same {@link AuthenticationFailedException}. An unknown
 * principal still costs one hash verification (against a dummy hash) and the
 * secret is checked before the active flag, so neither timing nor error reveals
 * which part was wrong.
 */
@Service
public class CredentialVerifier {

    private final PrincipalStore principalStore;
    private final PasswordEncoder passwordEncoder;
    private final String dummyHash;

    public CredentialVerifier(PrincipalStore principalStore, PasswordEncoder passwordEncoder) {
        this.principalStore = principalStore;
        this.passwordEncoder = passwordEncoder;
        this.dummyHash = passwordEncoder.encode(UUID.randomUUID().toString());
    }

    public static String normalizeEmail(String email) {
        return email == null ? "" : email.trim().toLowerCase(Locale.ROOT);
    }

    public User verify(String email, String secret) {
        return check(principalStore.findByEmail(normalizeEmail(email)), secret);
    }

    public User verify(Long subjectId, String secret) {
        return check(principalStore.findById(subjectId), secret);
    }

    private User check(Optional<User> candidate, String secret) {
        String raw = secret == null ? "" : secret;
        String hash = candidate.map(User::getPasswordHash).orElse(dummyHash);

        boolean matches = passwordEncoder.matches(raw, hash);
        if (candidate.isEmpty() || !matches || !candidate.get().isActive()) {
            throw new AuthenticationFailedException();
        }
        return candidate.get();
    }
}
