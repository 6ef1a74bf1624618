package com.example.authservice.service;

import com.example.authservice.config.RbacProperties;
import com.example.authservice.entity.Role;
import com.example.authservice.exception.ForbiddenException;
import com.example.authservice.exception.TokenRevokedException;
import com.example.authservice.revocation.RevocationStore;
import com.example.authservice.store.RoleStore;
import com.example.authservice.token.JwtService;
import com.example.authservice.token.TokenClaims;
import com.example.authservice.token.TokenType;
import org.springframework.stereotype.Service;

/**
 * Resolves an access token to its claims and gates operations by permission.
 *
 * Order of checks: signature, expiry, token type, blacklist, permission.
 * The role comes from the token (snapshotted at issuance); its permission set
 * is read from the role store at check time.
 */
@Service
public class AuthorizationResolver {

    private final JwtService jwtService;
    private final RevocationStore revocationStore;
    private final RoleStore roleStore;
    private final String adminRole;

    public AuthorizationResolver(JwtService jwtService, RevocationStore revocationStore,
                                 RoleStore roleStore, RbacProperties rbacProperties) {
        this.jwtService = jwtService;
        this.revocationStore = revocationStore;
        this.roleStore = roleStore;
        this.adminRole = rbacProperties.adminRole();
    }

    /**
     * @throws com.example.authservice.exception.TokenInvalidException (or subclass) if the token is not usable
     */
    public TokenClaims authenticate(String accessToken) {
        TokenClaims claims = jwtService.decode(accessToken).requireType(TokenType.ACCESS);
        if (revocationStore.isRevoked(claims)) {
            throw new TokenRevokedException();
        }
        return claims;
    }

    public TokenClaims authorize(String accessToken, String permission) {
        TokenClaims claims = authenticate(accessToken);
        requirePermission(claims, permission);
        return claims;
    }

    /**
     * @throws ForbiddenException if the token's role does not grant {@code permission}
     */
    public void requirePermission(TokenClaims claims, String permission) {
        if (!hasPermission(claims.role(), permission)) {
            throw new ForbiddenException(permission);
        }
    }

    /**
     * Admin satisfies every permission. An unknown role grants nothing.
     */
    public boolean hasPermission(String roleName, String permission) {
        if (roleName == null || permission == null) {
            return false;
        }
        if (roleName.equals(adminRole)) {
            return true;
        }
        return roleStore.findByName(roleName)
                .map((Role role) -> role.grants(permission))
                .orElse(false);
    }
}
