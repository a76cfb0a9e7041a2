package com.ranco.auth.global.tx;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.function.Function;

import com.ranco.auth.global.error.ErrorKind;
import com.ranco.auth.global.error.IdentityException;
import com.ranco.auth.modules.account.infrastructure.persistence.AccountRepository;
import com.ranco.auth.modules.authmethod.infrastructure.persistence.AuthMethodRepository;
import com.ranco.auth.modules.session.infrastructure.persistence.RefreshTokenRepository;
import com.ranco.auth.modules.verification.infrastructure.persistence.VerificationCodeRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.TransactionTimedOutException;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * {@link TransactionCoordinator} on top of the JPA transaction manager. This is also the
 * translation boundary: nothing store-specific escapes it.
 */
@Component
public class SpringTransactionCoordinator implements TransactionCoordinator {

    private static final Logger log = LoggerFactory.getLogger(SpringTransactionCoordinator.class);

    private final PlatformTransactionManager transactionManager;
    private final AccountRepository accountRepository;
    private final AuthMethodRepository authMethodRepository;
    private final VerificationCodeRepository verificationCodeRepository;
    private final RefreshTokenRepository refreshTokenRepository;
    private final Clock clock;

    public SpringTransactionCoordinator(
            PlatformTransactionManager transactionManager,
            AccountRepository accountRepository,
            AuthMethodRepository authMethodRepository,
            VerificationCodeRepository verificationCodeRepository,
            RefreshTokenRepository refreshTokenRepository,
            Clock clock
    ) {
        this.transactionManager = transactionManager;
        this.accountRepository = accountRepository;
        this.authMethodRepository = authMethodRepository;
        this.verificationCodeRepository = verificationCodeRepository;
        this.refreshTokenRepository = refreshTokenRepository;
        this.clock = clock;
    }

    @Override
    public <T> T runAtomic(ExecutionContext context, Function<UnitOfWork, T> work) {
        return execute(context, work, false);
    }

    @Override
    public <T> T runReadOnly(ExecutionContext context, Function<UnitOfWork, T> work) {
        return execute(context, work, true);
    }

    private <T> T execute(ExecutionContext context, Function<UnitOfWork, T> work, boolean readOnly) {
        Objects.requireNonNull(context, "context is required");
        Objects.requireNonNull(work, "work is required");
        context.ensureActive(clock);

        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);
        template.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        template.setReadOnly(readOnly);
        context.remaining(clock).ifPresent(remaining -> template.setTimeout(toTimeoutSeconds(remaining)));

        ScopedUnitOfWork unitOfWork = new ScopedUnitOfWork(context);
        try {
            return template.execute(status -> {
                T result = work.apply(unitOfWork);
                // a cancellation that arrives after the last repository call still aborts the commit
                unitOfWork.checkpoint();
                return result;
            });
        } catch (IdentityException ex) {
            if (ex.getKind() == ErrorKind.CANCELLED) {
                log.warn("Unit of work cancelled and rolled back: {}", ex.getCode());
            }
            throw ex;
        } catch (DataIntegrityViolationException ex) {
            log.debug("Store constraint rejected unit of work", ex);
            throw IdentityException.conflict(IdentityException.CONSTRAINT_VIOLATION, ex);
        } catch (TransactionTimedOutException | QueryTimeoutException ex) {
            log.warn("Unit of work ran past its deadline and was rolled back");
            throw IdentityException.cancelled(ExecutionContext.DEADLINE_EXCEEDED, ex);
        } catch (DataAccessException | TransactionException ex) {
            log.error("Persistence failure inside unit of work", ex);
            throw IdentityException.internal(ex);
        } catch (RuntimeException ex) {
            log.error("Unexpected failure inside unit of work", ex);
            throw IdentityException.internal(ex);
        } finally {
            unitOfWork.close();
        }
    }

    private static int toTimeoutSeconds(Duration remaining) {
        long millis = remaining.toMillis();
        long seconds = (millis + 999) / 1000;
        return (int) Math.max(1L, Math.min(seconds, Integer.MAX_VALUE));
    }

    private final class ScopedUnitOfWork implements UnitOfWork {

        private final ExecutionContext context;
        private volatile boolean open = true;

        private ScopedUnitOfWork(ExecutionContext context) {
            this.context = context;
        }

        @Override
        public ExecutionContext context() {
            return context;
        }

        @Override
        public AccountRepository accounts() {
            checkpoint();
            return accountRepository;
        }

        @Override
        public AuthMethodRepository authMethods() {
            checkpoint();
            return authMethodRepository;
        }

        @Override
        public VerificationCodeRepository verificationCodes() {
            checkpoint();
            return verificationCodeRepository;
        }

        @Override
        public RefreshTokenRepository refreshTokens() {
            checkpoint();
            return refreshTokenRepository;
        }

        @Override
        public void checkpoint() {
            if (!open) {
                throw new IllegalStateException("Unit of work already completed");
            }
            context.ensureActive(clock);
        }

        private void close() {
            open = false;
        }
    }
}
