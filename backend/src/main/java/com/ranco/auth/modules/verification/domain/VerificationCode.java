package com.ranco.auth.modules.verification.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.ranco.auth.global.jpa.AbstractCreatedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * One-time secret bound to an auth method. Only the hash is stored; attempts and consumption
 * are changed through conditional updates on the repository, never through the setters of a
 * loaded instance.
 */
@Entity
@Table(name = "verification_codes")
public class VerificationCode extends AbstractCreatedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "auth_method_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID authMethodId;

    @Column(name = "code_hash", nullable = false, updatable = false, length = 255)
    private String codeHash;

    @Column(name = "attempts", nullable = false)
    private int attempts;

    @Column(name = "expires_at", nullable = false, updatable = false)
    private OffsetDateTime expiresAt;

    @Column(name = "consumed_at")
    private OffsetDateTime consumedAt;

    protected VerificationCode() {
    }

    public VerificationCode(UUID authMethodId, String codeHash, OffsetDateTime expiresAt) {
        this.authMethodId = authMethodId;
        this.codeHash = codeHash;
        this.expiresAt = expiresAt;
        this.attempts = 0;
    }

    public UUID getId() {
        return id;
    }

    public UUID getAuthMethodId() {
        return authMethodId;
    }

    public String getCodeHash() {
        return codeHash;
    }

    public int getAttempts() {
        return attempts;
    }

    public OffsetDateTime getExpiresAt() {
        return expiresAt;
    }

    public OffsetDateTime getConsumedAt() {
        return consumedAt;
    }

    public boolean isActiveAt(OffsetDateTime now) {
        return consumedAt == null && expiresAt.isAfter(now);
    }
}
