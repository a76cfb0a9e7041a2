package com.ranco.auth.modules.identity.application;

import java.util.Map;
import java.util.UUID;

import com.ranco.auth.global.tx.ExecutionContext;
import com.ranco.auth.global.tx.TransactionCoordinator;
import com.ranco.auth.modules.account.application.AccountLifecycle;
import com.ranco.auth.modules.account.domain.Account;
import com.ranco.auth.modules.account.domain.AccountStatus;
import com.ranco.auth.modules.identity.domain.IdentityEvent;
import com.ranco.auth.modules.identity.presentation.dto.AccountSummaryResponse;
import com.ranco.auth.modules.session.application.SessionManager;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class AccountAdminService {

    private static final Logger log = LoggerFactory.getLogger(AccountAdminService.class);

    private final TransactionCoordinator transactionCoordinator;
    private final AccountLifecycle accountLifecycle;
    private final SessionManager sessionManager;
    private final IdentityEventDispatcher eventDispatcher;

    public AccountAdminService(
            TransactionCoordinator transactionCoordinator,
            AccountLifecycle accountLifecycle,
            SessionManager sessionManager,
            IdentityEventDispatcher eventDispatcher
    ) {
        this.transactionCoordinator = transactionCoordinator;
        this.accountLifecycle = accountLifecycle;
        this.sessionManager = sessionManager;
        this.eventDispatcher = eventDispatcher;
    }

    /**
     * Applies an administrative transition. Banning or deleting an account also ends every
     * session it holds.
     */
    public AccountSummaryResponse changeStatus(ExecutionContext context, UUID accountId, AccountStatus newStatus) {
        StatusChange change = transactionCoordinator.runAtomic(context, uow -> {
            AccountStatus previous = accountLifecycle.get(uow, accountId).getStatus();
            Account updated = accountLifecycle.setStatus(uow, accountId, newStatus);
            int revoked = newStatus.isTerminal() ? sessionManager.revokeAll(uow, accountId) : 0;
            return new StatusChange(updated, previous, revoked);
        });

        log.info("Account {} moved from {} to {}, {} session(s) revoked",
                accountId, change.previous(), newStatus, change.revokedSessions());
        eventDispatcher.emit(IdentityEvent.ACCOUNT_STATUS_CHANGED, accountId, Map.of(
                "from", change.previous().name(),
                "to", newStatus.name(),
                "revokedSessions", String.valueOf(change.revokedSessions())
        ));
        return AccountSummaryResponse.from(change.account());
    }

    private record StatusChange(Account account, AccountStatus previous, int revokedSessions) {
    }
}
