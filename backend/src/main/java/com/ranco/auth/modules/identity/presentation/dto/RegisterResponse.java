package com.ranco.auth.modules.identity.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.ranco.auth.modules.account.domain.AccountStatus;

/**
 * {@code codeExpiresAt} is null when the provider needs no verification step.
 */
public record RegisterResponse(
        UUID accountId,
        AccountStatus status,
        boolean verificationRequired,
        OffsetDateTime codeExpiresAt
) {
}
