package com.example.authservice.service;

import com.example.authservice.entity.AuditAction;
import com.example.authservice.entity.AuditLog;
import com.example.authservice.entity.User;
import com.example.authservice.repository.AuditLogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Service for writing the token lifecycle audit trail.
 *
 * - @Async: the caller never waits on the audit insert
 * - REQUIRES_NEW: a row survives a rollback of the caller's work
 * - A failed insert is logged and dropped; it never fails the operation being audited
 *
 * Raw tokens are never written; token family ids are.
 */
@Service
public class AuditService {

    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    private final AuditLogRepository auditLogRepository;

    public AuditService(AuditLogRepository auditLogRepository) {
        this.auditLogRepository = auditLogRepository;
    }

    // ==================== Authentication ====================

    @Async
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void logLoginSuccess(User user, String familyId) {
        record(AuditAction.LOGIN_SUCCESS, user.getId(), user.getEmail(), familyId,
                AuditLog.AuditOutcome.SUCCESS, null);
    }

    /**
     * @param email  normalized email as submitted (the principal may not exist)
     * @param reason internal reason, never returned to the caller
     */
    @Async
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void logLoginFailure(String email, String reason) {
        record(AuditAction.LOGIN_FAILED, null, email, null, AuditLog.AuditOutcome.FAILURE, reason);
    }

    @Async
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void logLogout(Long subjectId, String email, String familyId) {
        record(AuditAction.LOGOUT, subjectId, email, familyId, AuditLog.AuditOutcome.SUCCESS, null);
    }

    @Async
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void logLogoutAll(Long subjectId, int families) {
        record(AuditAction.LOGOUT_ALL, subjectId, null, null, AuditLog.AuditOutcome.SUCCESS,
                families + " session(s) revoked");
    }

    // ==================== Refresh rotation ====================

    @Async
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void logRefreshSuccess(Long subjectId, String familyId) {
        record(AuditAction.REFRESH_SUCCESS, subjectId, null, familyId, AuditLog.AuditOutcome.SUCCESS, null);
    }

    /**
     * Security event: a superseded refresh token was presented and its family was revoked.
     */
    @Async
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void logRefreshReuse(Long subjectId, String familyId, String tokenId) {
        record(AuditAction.REFRESH_REUSE, subjectId, null, familyId, AuditLog.AuditOutcome.DENIED,
                "Refresh token " + tokenId + " reused - family revoked");
    }

    // ==================== Credentials ====================

    @Async
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void logUserCreated(User user) {
        record(AuditAction.CREATE, user.getId(), user.getEmail(), null, AuditLog.AuditOutcome.SUCCESS,
                "role=" + user.getRoleName());
    }

    @Async
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void logPasswordResetRequested(User user) {
        record(AuditAction.PASSWORD_RESET_REQUESTED, user.getId(), user.getEmail(), null,
                AuditLog.AuditOutcome.SUCCESS, null);
    }

    @Async
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void logPasswordReset(User user) {
        record(AuditAction.PASSWORD_RESET, user.getId(), user.getEmail(), null, AuditLog.AuditOutcome.SUCCESS, null);
    }

    @Async
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void logPasswordChange(User user) {
        record(AuditAction.PASSWORD_CHANGE, user.getId(), user.getEmail(), null, AuditLog.AuditOutcome.SUCCESS, null);
    }

    // ==================== Internal ====================

    private void record(AuditAction action, Long subjectId, String email, String familyId,
                        AuditLog.AuditOutcome outcome, String detail) {
        try {
            auditLogRepository.save(AuditLog.builder()
                    .action(action)
                    .subjectId(subjectId)
                    .subjectEmail(email)
                    .familyId(familyId)
                    .outcome(outcome)
                    .detail(detail)
                    .build());

            log.debug("Audit log created: {} {} for subject {}", action, outcome, subjectId);
        } catch (DataAccessException e) {
            log.error("Failed to create audit log: {} {} for subject {}", action, outcome, subjectId, e);
        }
    }
}
