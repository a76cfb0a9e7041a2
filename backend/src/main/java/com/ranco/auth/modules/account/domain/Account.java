package com.ranco.auth.modules.account.domain;

import java.util.UUID;

import com.ranco.auth.global.jpa.AbstractCreatedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * Identity root. Auth methods and refresh tokens point at it by id only.
 */
@Entity
@Table(name = "accounts")
public class Account extends AbstractCreatedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(name = "role_code", nullable = false, updatable = false, length = 32)
    private AccountRole role;

    @Enumerated(EnumType.STRING)
    @Column(name = "status_code", nullable = false, length = 32)
    private AccountStatus status;

    protected Account() {
    }

    public Account(AccountRole role, AccountStatus status) {
        this.role = role;
        this.status = status;
    }

    public UUID getId() {
        return id;
    }

    public AccountRole getRole() {
        return role;
    }

    public AccountStatus getStatus() {
        return status;
    }

    public void setStatus(AccountStatus status) {
        this.status = status;
    }

    public boolean isActive() {
        return status == AccountStatus.ACTIVE;
    }
}
