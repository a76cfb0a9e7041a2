package com.ranco.auth.modules.account.domain;

import java.util.EnumSet;
import java.util.Set;

/**
 * Account lifecycle. Transitions only move forward along the edges below; BANNED and
 * DELETED are terminal.
 */
public enum AccountStatus {
    PENDING,
    ACTIVE,
    BANNED,
    DELETED;

    public Set<AccountStatus> allowedTargets() {
        return switch (this) {
            case PENDING -> EnumSet.of(ACTIVE, DELETED);
            case ACTIVE -> EnumSet.of(BANNED, DELETED);
            case BANNED, DELETED -> EnumSet.noneOf(AccountStatus.class);
        };
    }

    public boolean canTransitionTo(AccountStatus target) {
        return target != null && allowedTargets().contains(target);
    }

    public boolean isInitial() {
        return this == PENDING || this == ACTIVE;
    }

    public boolean isTerminal() {
        return this == BANNED || this == DELETED;
    }
}
