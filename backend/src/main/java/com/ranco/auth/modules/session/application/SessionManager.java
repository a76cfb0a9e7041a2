package com.ranco.auth.modules.session.application;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

import com.ranco.auth.global.crypto.CredentialHasher;
import com.ranco.auth.global.error.IdentityException;
import com.ranco.auth.global.tx.UnitOfWork;
import com.ranco.auth.modules.session.domain.ClientMeta;
import com.ranco.auth.modules.session.domain.IssuedSession;
import com.ranco.auth.modules.session.domain.RefreshToken;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Keeps at most one active refresh token per account. Starting a session revokes every
 * unrevoked token of the account before the new one is inserted, inside the same unit of work.
 */
@Component
public class SessionManager {

    public static final String SESSION_NOT_FOUND = "SESSION_NOT_FOUND";

    private final CredentialHasher credentialHasher;
    private final TokenIssuer tokenIssuer;
    private final Clock clock;
    private final long sessionTtlMillis;

    public SessionManager(
            CredentialHasher credentialHasher,
            TokenIssuer tokenIssuer,
            Clock clock,
            @Value("${jwt.refresh-expiration:2592000000}") long sessionTtlMillis
    ) {
        this.credentialHasher = credentialHasher;
        this.tokenIssuer = tokenIssuer;
        this.clock = clock;
        this.sessionTtlMillis = sessionTtlMillis;
    }

    /**
     * Only call this as the last step of a successful authentication.
     */
    public IssuedSession startSession(UnitOfWork uow, UUID accountId, ClientMeta clientMeta) {
        Objects.requireNonNull(accountId, "accountId is required");
        OffsetDateTime now = OffsetDateTime.now(clock);
        uow.refreshTokens().revokeOpenTokens(accountId, now);

        String secret = tokenIssuer.mintRefreshSecret();
        OffsetDateTime expiresAt = now.plus(Duration.ofMillis(sessionTtlMillis));
        RefreshToken token = new RefreshToken(
                accountId,
                credentialHasher.hash(secret),
                clientMeta == null ? ClientMeta.unknown() : clientMeta,
                expiresAt
        );
        RefreshToken saved = uow.refreshTokens().saveAndFlush(token);
        return new IssuedSession(saved.getId(), secret, expiresAt);
    }

    public void revoke(UnitOfWork uow, UUID tokenId) {
        int updated = uow.refreshTokens().revokeById(tokenId, OffsetDateTime.now(clock));
        if (updated == 0) {
            throw IdentityException.notFound(SESSION_NOT_FOUND);
        }
    }

    /**
     * Zero matching tokens is a success.
     */
    public int revokeAll(UnitOfWork uow, UUID accountId) {
        return uow.refreshTokens().revokeOpenTokens(accountId, OffsetDateTime.now(clock));
    }

    public Optional<RefreshToken> findActive(UnitOfWork uow, String plaintextToken) {
        if (plaintextToken == null || plaintextToken.isBlank()) {
            return Optional.empty();
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        return uow.refreshTokens().findByTokenHash(credentialHasher.hash(plaintextToken))
                .filter(token -> token.isActiveAt(now));
    }

    /**
     * @return the owning account id
     */
    public UUID validate(UnitOfWork uow, String plaintextToken) {
        return findActive(uow, plaintextToken)
                .map(RefreshToken::getAccountId)
                .orElseThrow(IdentityException::invalidToken);
    }
}
