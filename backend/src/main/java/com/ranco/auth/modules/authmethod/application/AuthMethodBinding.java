package com.ranco.auth.modules.authmethod.application;

import java.time.OffsetDateTime;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

import com.ranco.auth.global.error.IdentityException;
import com.ranco.auth.global.tx.UnitOfWork;
import com.ranco.auth.modules.authmethod.domain.AuthMethod;
import com.ranco.auth.modules.authmethod.domain.AuthProvider;

import org.springframework.stereotype.Component;

/**
 * Binds exactly one credential to an account. (provider, external id) is unique across the
 * whole system, and an account that already owns a method cannot get a second one.
 */
@Component
public class AuthMethodBinding {

    public static final String AUTH_METHOD_ALREADY_BOUND = "AUTH_METHOD_ALREADY_BOUND";
    public static final String ACCOUNT_ALREADY_BOUND = "ACCOUNT_ALREADY_BOUND";
    public static final String AUTH_METHOD_NOT_FOUND = "AUTH_METHOD_NOT_FOUND";

    public AuthMethod create(UnitOfWork uow, UUID accountId, AuthProvider provider, String externalId,
                             boolean initiallyVerified) {
        Objects.requireNonNull(accountId, "accountId is required");
        Objects.requireNonNull(provider, "provider is required");
        if (externalId == null || externalId.isBlank()) {
            throw new IllegalArgumentException("externalId must not be blank");
        }
        if (uow.authMethods().existsByProviderAndExternalId(provider, externalId)) {
            throw IdentityException.conflict(AUTH_METHOD_ALREADY_BOUND);
        }
        if (uow.authMethods().existsByAccountId(accountId)) {
            throw IdentityException.conflict(ACCOUNT_ALREADY_BOUND);
        }
        return uow.authMethods().saveAndFlush(new AuthMethod(accountId, provider, externalId, initiallyVerified));
    }

    /**
     * Absence is a normal outcome here, not an error.
     */
    public Optional<AuthMethod> findByProvider(UnitOfWork uow, AuthProvider provider, String externalId) {
        return uow.authMethods().findByProviderAndExternalId(provider, externalId);
    }

    public Optional<AuthMethod> findByAccount(UnitOfWork uow, UUID accountId) {
        return uow.authMethods().findByAccountId(accountId);
    }

    public AuthMethod get(UnitOfWork uow, UUID authMethodId) {
        return uow.authMethods().findById(authMethodId)
                .orElseThrow(() -> IdentityException.notFound(AUTH_METHOD_NOT_FOUND));
    }

    public AuthMethod markVerified(UnitOfWork uow, UUID authMethodId) {
        AuthMethod method = get(uow, authMethodId);
        if (method.isVerified()) {
            return method;
        }
        method.markVerified();
        return uow.authMethods().save(method);
    }

    public AuthMethod recordLogin(UnitOfWork uow, UUID authMethodId, OffsetDateTime timestamp) {
        AuthMethod method = get(uow, authMethodId);
        method.setLastLoginAt(timestamp);
        return uow.authMethods().save(method);
    }
}
