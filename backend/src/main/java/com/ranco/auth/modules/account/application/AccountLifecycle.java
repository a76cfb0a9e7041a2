package com.ranco.auth.modules.account.application;

import java.util.Objects;
import java.util.UUID;

import com.ranco.auth.global.error.IdentityException;
import com.ranco.auth.global.tx.UnitOfWork;
import com.ranco.auth.modules.account.domain.Account;
import com.ranco.auth.modules.account.domain.AccountRole;
import com.ranco.auth.modules.account.domain.AccountStatus;

import org.springframework.stereotype.Component;

/**
 * Sole owner of {@link Account} rows. Re-applying a transition that already happened is an
 * error here; callers decide whether to check first.
 */
@Component
public class AccountLifecycle {

    public static final String INVALID_STATUS_TRANSITION = "INVALID_STATUS_TRANSITION";

    public Account create(UnitOfWork uow, AccountRole role, AccountStatus initialStatus) {
        Objects.requireNonNull(role, "role is required");
        Objects.requireNonNull(initialStatus, "initialStatus is required");
        if (!initialStatus.isInitial()) {
            throw new IllegalArgumentException("Accounts cannot start in status " + initialStatus);
        }
        return uow.accounts().save(new Account(role, initialStatus));
    }

    public Account get(UnitOfWork uow, UUID accountId) {
        return uow.accounts().findById(accountId)
                .orElseThrow(() -> IdentityException.notFound(IdentityException.ACCOUNT_NOT_FOUND));
    }

    public Account setStatus(UnitOfWork uow, UUID accountId, AccountStatus newStatus) {
        Account account = get(uow, accountId);
        if (!account.getStatus().canTransitionTo(newStatus)) {
            throw IdentityException.conflict(INVALID_STATUS_TRANSITION);
        }
        account.setStatus(newStatus);
        return uow.accounts().save(account);
    }
}
