package com.ranco.auth.modules.identity.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Map;
import java.util.UUID;

import com.ranco.auth.global.error.IdentityException;
import com.ranco.auth.global.tx.ExecutionContext;
import com.ranco.auth.global.tx.UnitOfWork;
import com.ranco.auth.modules.account.application.AccountLifecycle;
import com.ranco.auth.modules.account.domain.Account;
import com.ranco.auth.modules.account.domain.AccountRole;
import com.ranco.auth.modules.account.domain.AccountStatus;
import com.ranco.auth.modules.identity.domain.IdentityEvent;
import com.ranco.auth.modules.identity.presentation.dto.AccountSummaryResponse;
import com.ranco.auth.modules.session.application.SessionManager;
import com.ranco.auth.support.DirectTransactionCoordinator;
import com.ranco.auth.support.TestEntities;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AccountAdminServiceTest {

    private static final UUID ACCOUNT_ID = UUID.fromString("00000000-0000-0000-0000-000000000101");

    @Mock
    private UnitOfWork uow;

    @Mock
    private AccountLifecycle accountLifecycle;

    @Mock
    private SessionManager sessionManager;

    @Mock
    private IdentityEventDispatcher eventDispatcher;

    private AccountAdminService service;

    @BeforeEach
    void setUp() {
        service = new AccountAdminService(new DirectTransactionCoordinator(uow), accountLifecycle, sessionManager, eventDispatcher);
    }

    @Test
    void banningRevokesEverySession() {
        when(accountLifecycle.get(uow, ACCOUNT_ID)).thenReturn(account(AccountStatus.ACTIVE));
        when(accountLifecycle.setStatus(uow, ACCOUNT_ID, AccountStatus.BANNED)).thenReturn(account(AccountStatus.BANNED));
        when(sessionManager.revokeAll(uow, ACCOUNT_ID)).thenReturn(2);

        AccountSummaryResponse response = service.changeStatus(ExecutionContext.background(), ACCOUNT_ID, AccountStatus.BANNED);

        assertThat(response.status()).isEqualTo(AccountStatus.BANNED);
        verify(eventDispatcher).emit(IdentityEvent.ACCOUNT_STATUS_CHANGED, ACCOUNT_ID,
                Map.of("from", "ACTIVE", "to", "BANNED", "revokedSessions", "2"));
    }

    @Test
    void nonTerminalTransitionKeepsSessions() {
        when(accountLifecycle.get(uow, ACCOUNT_ID)).thenReturn(account(AccountStatus.PENDING));
        when(accountLifecycle.setStatus(uow, ACCOUNT_ID, AccountStatus.ACTIVE)).thenReturn(account(AccountStatus.ACTIVE));

        service.changeStatus(ExecutionContext.background(), ACCOUNT_ID, AccountStatus.ACTIVE);

        verify(sessionManager, never()).revokeAll(any(), any());
    }

    @Test
    void rejectedTransitionEmitsNothing() {
        when(accountLifecycle.get(uow, ACCOUNT_ID)).thenReturn(account(AccountStatus.DELETED));
        when(accountLifecycle.setStatus(uow, ACCOUNT_ID, AccountStatus.ACTIVE))
                .thenThrow(IdentityException.conflict(AccountLifecycle.INVALID_STATUS_TRANSITION));

        assertThatThrownBy(() -> service.changeStatus(ExecutionContext.background(), ACCOUNT_ID, AccountStatus.ACTIVE))
                .isInstanceOfSatisfying(IdentityException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo(AccountLifecycle.INVALID_STATUS_TRANSITION));
        verify(eventDispatcher, never()).emit(eq(IdentityEvent.ACCOUNT_STATUS_CHANGED), any(), anyMap());
    }

    private static Account account(AccountStatus status) {
        return TestEntities.withId(new Account(AccountRole.USER, status), ACCOUNT_ID);
    }
}
