package com.example.authservice.security;

import com.example.authservice.service.AuthorizationResolver;
import com.example.authservice.token.TokenClaims;
import org.springframework.security.core.Authentication;
import org.springframework.stereotype.Component;

/**
 * Permission check for method security expressions:
 * {@code @PreAuthorize("@rbac.hasPermission(authentication, 'read:self')")}.
 */
@Component("rbac")
public class RbacGuard {

    private final AuthorizationResolver authorizationResolver;

    public RbacGuard(AuthorizationResolver authorizationResolver) {
        this.authorizationResolver = authorizationResolver;
    }

    public boolean hasPermission(Authentication authentication, String permission) {
        if (authentication == null || !(authentication.getPrincipal() instanceof TokenClaims claims)) {
            return false;
        }
        return authorizationResolver.hasPermission(claims.role(), permission);
    }
}
