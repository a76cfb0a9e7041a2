package com.ranco.auth.modules.authmethod.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

@Entity
@Table(name = "auth_methods")
public class AuthMethod {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "account_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID accountId;

    @Enumerated(EnumType.STRING)
    @Column(name = "provider_code", nullable = false, updatable = false, length = 32)
    private AuthProvider provider;

    @Column(name = "provider_id", nullable = false, updatable = false, length = 255)
    private String externalId;

    @Column(name = "is_verified", nullable = false)
    private boolean verified;

    @Column(name = "last_login_at")
    private OffsetDateTime lastLoginAt;

    protected AuthMethod() {
    }

    public AuthMethod(UUID accountId, AuthProvider provider, String externalId, boolean verified) {
        this.accountId = accountId;
        this.provider = provider;
        this.externalId = externalId;
        this.verified = verified;
    }

    public UUID getId() {
        return id;
    }

    public UUID getAccountId() {
        return accountId;
    }

    public AuthProvider getProvider() {
        return provider;
    }

    public String getExternalId() {
        return externalId;
    }

    public boolean isVerified() {
        return verified;
    }

    public void markVerified() {
        this.verified = true;
    }

    public OffsetDateTime getLastLoginAt() {
        return lastLoginAt;
    }

    public void setLastLoginAt(OffsetDateTime lastLoginAt) {
        this.lastLoginAt = lastLoginAt;
    }
}
