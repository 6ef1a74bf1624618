package com.example.authservice.controller;

import com.example.authservice.dto.ChangePasswordRequest;
import com.example.authservice.dto.ClaimsResponse;
import com.example.authservice.dto.ForgotPasswordRequest;
import com.example.authservice.dto.LoginRequest;
import com.example.authservice.dto.LoginResponse;
import com.example.authservice.dto.RefreshTokenRequest;
import com.example.authservice.dto.RegisterRequest;
import com.example.authservice.dto.ResetPasswordRequest;
import com.example.authservice.dto.UserDto;
import com.example.authservice.exception.AuthenticationFailedException;
import com.example.authservice.exception.TokenInvalidException;
import com.example.authservice.security.SecurityContextHelper;
import com.example.authservice.service.AuthService;
import com.example.authservice.token.TokenClaims;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Authentication controller.
 *
 * Bearer-protected endpoints rely on {@code JwtAuthenticationFilter} having
 * resolved the access token into the SecurityContext.
 */
@RestController
@RequestMapping("/api/auth")
public class AuthController {

    private static final Logger log = LoggerFactory.getLogger(AuthController.class);

    private final AuthService authService;
    private final SecurityContextHelper securityContextHelper;

    public AuthController(AuthService authService, SecurityContextHelper securityContextHelper) {
        this.authService = authService;
        this.securityContextHelper = securityContextHelper;
    }

    /**
     * POST /api/auth/register
     *
     * @return 201 Created with the new user
     * @throws com.example.authservice.exception.EmailAlreadyExistsException 409 Conflict
     */
    @PostMapping("/register")
    public ResponseEntity<UserDto> register(@Valid @RequestBody RegisterRequest request) {
        UserDto user = UserDto.fromEntity(
                authService.register(request.email(), request.password(), request.fullName()));
        return ResponseEntity.status(HttpStatus.CREATED).body(user);
    }

    /**
     * POST /api/auth/login
     *
     * @return 200 OK with access/refresh tokens
     * @throws AuthenticationFailedException 401 Unauthorized
     */
    @PostMapping("/login")
    public ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest request) {
        return ResponseEntity.ok(LoginResponse.of(authService.login(request.email(), request.password())));
    }

    /**
     * POST /api/auth/refresh
     *
     * @return 200 OK with the rotated pair
     * @throws TokenInvalidException 401 (expired, revoked, reused, malformed)
     */
    @PostMapping("/refresh")
    public ResponseEntity<LoginResponse> refresh(@Valid @RequestBody RefreshTokenRequest request) {
        return ResponseEntity.ok(LoginResponse.of(authService.refresh(request.refreshToken())));
    }

    /**
     * POST /api/auth/logout
     *
     * Revokes the presented access token and its session.
     */
    @PostMapping("/logout")
    public ResponseEntity<Void> logout() {
        authService.logout(currentAccessToken());
        return ResponseEntity.noContent().build();
    }

    /**
     * POST /api/auth/logout-all
     *
     * Revokes every session of the caller.
     */
    @PostMapping("/logout-all")
    public ResponseEntity<Void> logoutAll() {
        authService.logoutAll(currentClaims().subjectId());
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/me")
    @PreAuthorize("@rbac.hasPermission(authentication, 'read:self')")
    public ResponseEntity<ClaimsResponse> me() {
        return ResponseEntity.ok(ClaimsResponse.from(currentClaims()));
    }

    /**
     * GET /api/auth/authorize?permission=...
     *
     * @return 200 OK with the claims when the caller's role grants the permission
     * @throws com.example.authservice.exception.ForbiddenException 403 Forbidden
     */
    @GetMapping("/authorize")
    public ResponseEntity<ClaimsResponse> authorize(@RequestParam("permission") String permission) {
        TokenClaims claims = authService.authorize(currentAccessToken(), permission);
        return ResponseEntity.ok(ClaimsResponse.from(claims));
    }

    /**
     * POST /api/auth/forgot-password
     *
     * Always 202 Accepted, whether or not the account exists.
     */
    @PostMapping("/forgot-password")
    public ResponseEntity<Void> forgotPassword(@Valid @RequestBody ForgotPasswordRequest request) {
        try {
            authService.requestPasswordReset(request.email());
        } catch (AuthenticationFailedException e) {
            log.debug("Password reset requested for unknown or inactive account");
        }
        return ResponseEntity.accepted().build();
    }

    /**
     * POST /api/auth/reset-password
     *
     * @throws TokenInvalidException 401 (consumed, expired, wrong purpose)
     */
    @PostMapping("/reset-password")
    public ResponseEntity<Void> resetPassword(@Valid @RequestBody ResetPasswordRequest request) {
        authService.confirmPasswordReset(request.token(), request.newPassword());
        return ResponseEntity.noContent().build();
    }

    /**
     * POST /api/auth/change-password
     *
     * Ends every session of the caller, including the current one.
     */
    @PostMapping("/change-password")
    public ResponseEntity<Void> changePassword(@Valid @RequestBody ChangePasswordRequest request) {
        authService.changePassword(currentClaims().subjectId(), request.currentPassword(), request.newPassword());
        return ResponseEntity.noContent().build();
    }

    private TokenClaims currentClaims() {
        return securityContextHelper.getCurrentClaims().orElseThrow(TokenInvalidException::new);
    }

    private String currentAccessToken() {
        return securityContextHelper.getCurrentAccessToken().orElseThrow(TokenInvalidException::new);
    }
}
