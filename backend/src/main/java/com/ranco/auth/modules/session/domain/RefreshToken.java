package com.ranco.auth.modules.session.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.ranco.auth.global.jpa.AbstractCreatedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

@Entity
@Table(name = "refresh_tokens")
public class RefreshToken extends AbstractCreatedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "account_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID accountId;

    @Column(name = "token_hash", nullable = false, unique = true, updatable = false, length = 255)
    private String tokenHash;

    @Column(name = "ip_address", length = 45, updatable = false)
    private String ipAddress;

    @Column(name = "user_agent", updatable = false, columnDefinition = "text")
    private String userAgent;

    @Column(name = "revoked_at")
    private OffsetDateTime revokedAt;

    @Column(name = "expires_at", nullable = false, updatable = false)
    private OffsetDateTime expiresAt;

    protected RefreshToken() {
    }

    public RefreshToken(UUID accountId, String tokenHash, ClientMeta clientMeta, OffsetDateTime expiresAt) {
        this.accountId = accountId;
        this.tokenHash = tokenHash;
        this.ipAddress = clientMeta.ipAddress();
        this.userAgent = clientMeta.userAgent();
        this.expiresAt = expiresAt;
    }

    public UUID getId() {
        return id;
    }

    public UUID getAccountId() {
        return accountId;
    }

    public String getTokenHash() {
        return tokenHash;
    }

    public String getIpAddress() {
        return ipAddress;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public OffsetDateTime getRevokedAt() {
        return revokedAt;
    }

    public OffsetDateTime getExpiresAt() {
        return expiresAt;
    }

    public boolean isActiveAt(OffsetDateTime now) {
        return revokedAt == null && expiresAt.isAfter(now);
    }
}
