package com.ranco.auth.modules.session.application;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.ranco.auth.modules.account.domain.AccountRole;
import com.ranco.auth.modules.account.domain.AccountStatus;

/**
 * Mints the two credentials a session hands out: a signed short-lived access credential
 * and an opaque refresh secret.
 */
public interface TokenIssuer {

    SignedAccessToken signAccessToken(AccessClaims claims);

    String mintRefreshSecret();

    /**
     * @throws InvalidAccessTokenException when the signature, expiry or claims do not check out
     */
    VerifiedAccessToken verifyAccessToken(String token);

    record AccessClaims(UUID accountId, AccountRole role, AccountStatus status) {
    }

    record SignedAccessToken(String token, long expiresInSeconds, OffsetDateTime issuedAt) {

        @Override
        public String toString() {
            return "SignedAccessToken[token=******, expiresInSeconds=" + expiresInSeconds + ", issuedAt=" + issuedAt + "]";
        }
    }

    record VerifiedAccessToken(UUID accountId, AccountRole role, AccountStatus status,
                               OffsetDateTime issuedAt, OffsetDateTime expiresAt) {
    }

    class InvalidAccessTokenException extends RuntimeException {
        public InvalidAccessTokenException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
