package com.ranco.auth.global.tx;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicReference;

import com.ranco.auth.global.error.ErrorKind;
import com.ranco.auth.global.error.IdentityException;
import com.ranco.auth.modules.account.infrastructure.persistence.AccountRepository;
import com.ranco.auth.modules.authmethod.infrastructure.persistence.AuthMethodRepository;
import com.ranco.auth.modules.session.infrastructure.persistence.RefreshTokenRepository;
import com.ranco.auth.modules.verification.infrastructure.persistence.VerificationCodeRepository;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DataRetrievalFailureException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionStatus;

@ExtendWith(MockitoExtension.class)
class SpringTransactionCoordinatorTest {

    private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");

    @Mock
    private PlatformTransactionManager transactionManager;

    @Mock
    private TransactionStatus transactionStatus;

    @Mock
    private AccountRepository accountRepository;

    @Mock
    private AuthMethodRepository authMethodRepository;

    @Mock
    private VerificationCodeRepository verificationCodeRepository;

    @Mock
    private RefreshTokenRepository refreshTokenRepository;

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private SpringTransactionCoordinator coordinator;

    @BeforeEach
    void setUp() {
        coordinator = new SpringTransactionCoordinator(transactionManager, accountRepository, authMethodRepository,
                verificationCodeRepository, refreshTokenRepository, clock);
        lenient().when(transactionManager.getTransaction(any())).thenReturn(transactionStatus);
    }

    @Test
    void commitsSuccessfulWorkWithReadCommittedAndDeadlineTimeout() {
        ExecutionContext context = ExecutionContext.withTimeout(clock, Duration.ofMillis(2500));

        String result = coordinator.runAtomic(context, uow -> {
            assertThat(uow.accounts()).isSameAs(accountRepository);
            return "done";
        });

        assertThat(result).isEqualTo("done");
        ArgumentCaptor<TransactionDefinition> definition = ArgumentCaptor.forClass(TransactionDefinition.class);
        verify(transactionManager).getTransaction(definition.capture());
        assertThat(definition.getValue().getIsolationLevel()).isEqualTo(TransactionDefinition.ISOLATION_READ_COMMITTED);
        assertThat(definition.getValue().getPropagationBehavior()).isEqualTo(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        assertThat(definition.getValue().getTimeout()).isEqualTo(3);
        assertThat(definition.getValue().isReadOnly()).isFalse();
        verify(transactionManager).commit(transactionStatus);
    }

    @Test
    void readOnlyRunsAreFlaggedReadOnly() {
        coordinator.runReadOnly(ExecutionContext.background(), uow -> 1);

        ArgumentCaptor<TransactionDefinition> definition = ArgumentCaptor.forClass(TransactionDefinition.class);
        verify(transactionManager).getTransaction(definition.capture());
        assertThat(definition.getValue().isReadOnly()).isTrue();
        assertThat(definition.getValue().getTimeout()).isEqualTo(TransactionDefinition.TIMEOUT_DEFAULT);
    }

    @Test
    void constraintViolationRollsBackAndBecomesConflict() {
        assertThatThrownBy(() -> coordinator.runAtomic(ExecutionContext.background(), uow -> {
            throw new DataIntegrityViolationException("duplicate key");
        })).isInstanceOfSatisfying(IdentityException.class, ex -> {
            assertThat(ex.getKind()).isEqualTo(ErrorKind.CONFLICT);
            assertThat(ex.getCode()).isEqualTo(IdentityException.CONSTRAINT_VIOLATION);
        });

        verify(transactionManager).rollback(transactionStatus);
        verify(transactionManager, never()).commit(any());
    }

    @Test
    void storeFailureBecomesInternal() {
        assertThatThrownBy(() -> coordinator.runAtomic(ExecutionContext.background(), uow -> {
            throw new DataRetrievalFailureException("connection reset");
        })).isInstanceOfSatisfying(IdentityException.class,
                ex -> assertThat(ex.getKind()).isEqualTo(ErrorKind.INTERNAL));

        verify(transactionManager).rollback(transactionStatus);
    }

    @Test
    void domainErrorsPassThroughUnchangedAndRollBack() {
        IdentityException domainError = IdentityException.invalidCredentials();

        assertThatThrownBy(() -> coordinator.runAtomic(ExecutionContext.background(), uow -> {
            throw domainError;
        })).isSameAs(domainError);

        verify(transactionManager).rollback(transactionStatus);
    }

    @Test
    void cancelledContextNeverOpensATransaction() {
        ExecutionContext context = ExecutionContext.withTimeout(clock, Duration.ofSeconds(5));
        context.cancel();

        assertThatThrownBy(() -> coordinator.runAtomic(context, uow -> "never"))
                .isInstanceOfSatisfying(IdentityException.class,
                        ex -> assertThat(ex.getKind()).isEqualTo(ErrorKind.CANCELLED));
        verifyNoInteractions(transactionManager);
    }

    @Test
    void cancellationDuringWorkRollsBack() {
        ExecutionContext context = ExecutionContext.withTimeout(clock, Duration.ofSeconds(5));

        assertThatThrownBy(() -> coordinator.runAtomic(context, uow -> {
            uow.accounts();
            context.cancel();
            return uow.refreshTokens();
        })).isInstanceOfSatisfying(IdentityException.class,
                ex -> assertThat(ex.getKind()).isEqualTo(ErrorKind.CANCELLED));

        verify(transactionManager).rollback(transactionStatus);
        verify(transactionManager, never()).commit(any());
    }

    @Test
    void unitOfWorkIsDeadAfterCompletion() {
        AtomicReference<UnitOfWork> leaked = new AtomicReference<>();
        coordinator.runAtomic(ExecutionContext.background(), uow -> {
            leaked.set(uow);
            return null;
        });

        assertThatThrownBy(() -> leaked.get().accounts()).isInstanceOf(IllegalStateException.class);
    }
}
