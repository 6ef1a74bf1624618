package com.example.authservice.service;

import com.example.authservice.config.RbacProperties;
import com.example.authservice.config.TokenProperties;
import com.example.authservice.entity.User;
import com.example.authservice.exception.AuthenticationFailedException;
import com.example.authservice.exception.EmailAlreadyExistsException;
import com.example.authservice.revocation.RevocationStore;
import com.example.authservice.store.PrincipalStore;
import com.example.authservice.token.TokenClaims;
import com.example.authservice.token.TokenIssuer;
import com.example.authservice.token.TokenPair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Authentication service: the operations exposed to the HTTP layer.
 */
@Service
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    private final CredentialVerifier credentialVerifier;
    private final TokenIssuer tokenIssuer;
    private final RefreshTokenService refreshTokenService;
    private final AuthorizationResolver authorizationResolver;
    private final PasswordResetTokenService passwordResetTokenService;
    private final PasswordResetNotifier passwordResetNotifier;
    private final RevocationStore revocationStore;
    private final PrincipalStore principalStore;
    private final PasswordEncoder passwordEncoder;
    private final AuditService auditService;
    private final RbacProperties rbacProperties;
    private final TokenProperties tokenProperties;
    private final Clock clock;

    public AuthService(
            CredentialVerifier credentialVerifier,
            TokenIssuer tokenIssuer,
            RefreshTokenService refreshTokenService,
            AuthorizationResolver authorizationResolver,
            PasswordResetTokenService passwordResetTokenService,
            PasswordResetNotifier passwordResetNotifier,
            RevocationStore revocationStore,
            PrincipalStore principalStore,
            PasswordEncoder passwordEncoder,
            AuditService auditService,
            RbacProperties rbacProperties,
            TokenProperties tokenProperties,
            Clock clock) {
        this.credentialVerifier = credentialVerifier;
        this.tokenIssuer = tokenIssuer;
        this.refreshTokenService = refreshTokenService;
        this.authorizationResolver = authorizationResolver;
        this.passwordResetTokenService = passwordResetTokenService;
        this.passwordResetNotifier = passwordResetNotifier;
        this.revocationStore = revocationStore;
        this.principalStore = principalStore;
        this.passwordEncoder = passwordEncoder;
        this.auditService = auditService;
        this.rbacProperties = rbacProperties;
        this.tokenProperties = tokenProperties;
        this.clock = clock;
    }

    /**
     * Register a principal with the default role. No tokens are issued; the caller logs in next.
     *
     * @throws EmailAlreadyExistsException if the normalized email is taken (409)
     */
    public User register(String email, String secret, String fullName) {
        User user = new User();
        user.setEmail(CredentialVerifier.normalizeEmail(email));
        user.setPasswordHash(passwordEncoder.encode(secret));
        user.setFullName(fullName);
        user.setRoleName(rbacProperties.defaultRole());
        user.setActive(true);

        User created = principalStore.create(user);

        auditService.logUserCreated(created);
        log.info("Registered user {} with role {}", created.getId(), created.getRoleName());
        return created;
    }

    /**
     * Verify credentials and open a new session.
     *
     * @throws AuthenticationFailedException unknown email, wrong secret or inactive principal (401)
     */
    public TokenPair login(String email, String secret) {
        User user;
        try {
            user = credentialVerifier.verify(email, secret);
        } catch (AuthenticationFailedException e) {
            auditService.logLoginFailure(CredentialVerifier.normalizeEmail(email), "Invalid credentials");
            throw e;
        }

        TokenPair pair = tokenIssuer.issuePair(user);
        principalStore.recordLogin(user.getId());

        auditService.logLoginSuccess(user, pair.refreshClaims().familyId());
        log.info("User {} logged in, session {}", user.getId(), pair.refreshClaims().familyId());
        return pair;
    }

    public TokenPair refresh(String refreshToken) {
        return refreshTokenService.rotate(refreshToken);
    }

    /**
     * Blacklist the access token until it stops verifying and end its session,
     * so the paired refresh token cannot mint new access tokens.
     */
    public void logout(String accessToken) {
        TokenClaims claims = authorizationResolver.authenticate(accessToken);

        revocationStore.revokeToken(claims.tokenId(),
                claims.revocationTtl(clock.instant(), tokenProperties.clockSkew()));
        if (claims.familyId() != null) {
            refreshTokenService.revokeFamily(claims.familyId());
        }

        auditService.logLogout(claims.subjectId(), claims.email(), claims.familyId());
        log.info("User {} logged out, session {}", claims.subjectId(), claims.familyId());
    }

    public void logoutAll(Long subjectId) {
        int families = refreshTokenService.revokeAllSessions(subjectId);
        auditService.logLogoutAll(subjectId, families);
    }

    public TokenClaims authorize(String accessToken, String permission) {
        return authorizationResolver.authorize(accessToken, permission);
    }

    /**
     * Issue a reset token and hand it to the notifier.
     *
     * @throws AuthenticationFailedException unknown or inactive principal
     */
    public String requestPasswordReset(String email) {
        User user = principalStore.findByEmail(CredentialVerifier.normalizeEmail(email))
                .filter(User::isActive)
                .orElseThrow(AuthenticationFailedException::new);

        String resetToken = passwordResetTokenService.issue(user);
        passwordResetNotifier.send(user, resetToken);

        auditService.logPasswordResetRequested(user);
        return resetToken;
    }

    /**
     * Consume the reset token, store the new secret and end every session of the principal.
     * The token stays consumed even if a later step fails.
     */
    public void confirmPasswordReset(String resetToken, String newSecret) {
        Long subjectId = passwordResetTokenService.consume(resetToken);

        User user = principalStore.findById(subjectId)
                .filter(User::isActive)
                .orElseThrow(AuthenticationFailedException::new);

        principalStore.updatePasswordHash(user.getId(), passwordEncoder.encode(newSecret));
        refreshTokenService.revokeAllSessions(user.getId());

        auditService.logPasswordReset(user);
        log.info("Password reset completed for user {}", user.getId());
    }

    public void changePassword(Long subjectId, String currentSecret, String newSecret) {
        User user = credentialVerifier.verify(subjectId, currentSecret);

        principalStore.updatePasswordHash(user.getId(), passwordEncoder.encode(newSecret));
        refreshTokenService.revokeAllSessions(user.getId());

        auditService.logPasswordChange(user);
        log.info("Password changed for user {}", user.getId());
    }
}
