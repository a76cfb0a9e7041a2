package com.ranco.auth.modules.identity.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.ranco.auth.modules.account.domain.AccountRole;
import com.ranco.auth.modules.account.domain.AccountStatus;
import com.ranco.auth.modules.authmethod.domain.AuthProvider;

public record AccountProfileResponse(
        UUID id,
        AccountRole role,
        AccountStatus status,
        AuthProvider provider,
        boolean verified,
        OffsetDateTime lastLoginAt,
        OffsetDateTime createdAt
) {
}
