package com.example.authservice.entity;

/**
 * Audit action types for AuditLog.
 */
public enum AuditAction {
    // Entity lifecycle
    CREATE,                   // User registered

    // Authentication actions
    LOGIN_SUCCESS,
    LOGIN_FAILED,             // Generic failure (unknown email, wrong secret, inactive)
    LOGOUT,
    LOGOUT_ALL,
    REFRESH_SUCCESS,
    REFRESH_REUSE,            // Superseded refresh token replayed (security event)

    // Credential management
    PASSWORD_RESET_REQUESTED,
    PASSWORD_RESET,
    PASSWORD_CHANGE
}
