package com.ranco.auth.global.tx;

import com.ranco.auth.modules.account.infrastructure.persistence.AccountRepository;
import com.ranco.auth.modules.authmethod.infrastructure.persistence.AuthMethodRepository;
import com.ranco.auth.modules.session.infrastructure.persistence.RefreshTokenRepository;
import com.ranco.auth.modules.verification.infrastructure.persistence.VerificationCodeRepository;

/**
 * Scoped handle on one open transaction. Components receive it explicitly and reach the
 * repositories only through it, so every call made with the same handle joins the same
 * transaction. Each accessor re-checks the execution context; the handle is dead once the
 * unit of work has completed.
 */
public interface UnitOfWork {

    ExecutionContext context();

    AccountRepository accounts();

    AuthMethodRepository authMethods();

    VerificationCodeRepository verificationCodes();

    RefreshTokenRepository refreshTokens();

    /**
     * Fails with {@code CANCELLED} when the context was cancelled or ran out of time.
     */
    void checkpoint();
}
