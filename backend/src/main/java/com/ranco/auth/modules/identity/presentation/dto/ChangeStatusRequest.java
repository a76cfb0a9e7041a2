package com.ranco.auth.modules.identity.presentation.dto;

import com.ranco.auth.modules.account.domain.AccountStatus;

import jakarta.validation.constraints.NotNull;

public record ChangeStatusRequest(
        @NotNull(message = "status is required") AccountStatus status
) {
}
