package com.example.authservice.security;

import com.example.authservice.token.TokenClaims;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Reads the resolved access token of the current request from the SecurityContext.
 * Optionals are empty for anonymous requests.
 */
@Component
public class SecurityContextHelper {

    public Optional<TokenClaims> getCurrentClaims() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !authentication.isAuthenticated()) {
            return Optional.empty();
        }
        if (authentication.getPrincipal() instanceof TokenClaims claims) {
            return Optional.of(claims);
        }
        return Optional.empty();
    }

    public Optional<Long> getCurrentUserId() {
        return getCurrentClaims().map(TokenClaims::subjectId);
    }

    /**
     * Raw bearer token, kept as the authentication credentials.
     */
    public Optional<String> getCurrentAccessToken() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication != null && authentication.getCredentials() instanceof String token) {
            return Optional.of(token);
        }
        return Optional.empty();
    }
}
