package com.example.authservice.entity;

import jakarta.persistence.*;
import java.time.LocalDateTime;

/**
 * Audit Log entity for security-relevant token lifecycle events.
 *
 * Rows are append-only. Raw tokens are never stored; the token family id
 * is kept so a reuse event can be correlated with the login it came from.
 */
@Entity
@Table(name = "audit_logs", indexes = {
    @Index(name = "idx_audit_subject", columnList = "subject_id"),
    @Index(name = "idx_audit_action", columnList = "action"),
    @Index(name = "idx_audit_created_at", columnList = "created_at"),
    @Index(name = "idx_audit_outcome", columnList = "outcome")
})
public class AuditLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 50)
    @Enumerated(EnumType.STRING)
    private AuditAction action;

    // Who (NULL when the principal is unknown, e.g. failed login)
    @Column(name = "subject_id")
    private Long subjectId;

    @Column(name = "subject_email", length = 255)
    private String subjectEmail;

    @Column(name = "family_id", length = 36)
    private String familyId;

    @Column(columnDefinition = "TEXT")
    private String detail;

    @Column(nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    private AuditOutcome outcome = AuditOutcome.SUCCESS;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public enum AuditOutcome {
        SUCCESS,
        FAILURE,  // e.g. wrong password
        DENIED    // e.g. token reuse
    }

    @PrePersist
    protected void onCreate() {
        this.createdAt = LocalDateTime.now();
    }

    protected AuditLog() {
    }

    private AuditLog(Builder builder) {
        this.action = builder.action;
        this.subjectId = builder.subjectId;
        this.subjectEmail = builder.subjectEmail;
        this.familyId = builder.familyId;
        this.detail = builder.detail;
        this.outcome = builder.outcome;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private AuditAction action;
        private Long subjectId;
        private String subjectEmail;
        private String familyId;
        private String detail;
        private AuditOutcome outcome = AuditOutcome.SUCCESS;

        public Builder action(AuditAction action) {
            this.action = action;
            return this;
        }

        public Builder subjectId(Long subjectId) {
            this.subjectId = subjectId;
            return this;
        }

        public Builder subjectEmail(String subjectEmail) {
            this.subjectEmail = subjectEmail;
            return this;
        }

        public Builder familyId(String familyId) {
            this.familyId = familyId;
            return this;
        }

        public Builder detail(String detail) {
            this.detail = detail;
            return this;
        }

        public Builder outcome(AuditOutcome outcome) {
            this.outcome = outcome;
            return this;
        }

        public AuditLog build() {
            return new AuditLog(this);
        }
    }

    // Getters only (immutable)
    public Long getId() { return id; }
    public AuditAction getAction() { return action; }
    public Long getSubjectId() { return subjectId; }
    public String getSubjectEmail() { return subjectEmail; }
    public String getFamilyId() { return familyId; }
    public String getDetail() { return detail; }
    public AuditOutcome getOutcome() { return outcome; }
    public LocalDateTime getCreatedAt() { return createdAt; }
}
