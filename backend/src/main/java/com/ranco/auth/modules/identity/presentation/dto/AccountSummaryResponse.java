package com.ranco.auth.modules.identity.presentation.dto;

import java.util.UUID;

import com.ranco.auth.modules.account.domain.Account;
import com.ranco.auth.modules.account.domain.AccountRole;
import com.ranco.auth.modules.account.domain.AccountStatus;

public record AccountSummaryResponse(UUID id, AccountRole role, AccountStatus status) {

    public static AccountSummaryResponse from(Account account) {
        return new AccountSummaryResponse(account.getId(), account.getRole(), account.getStatus());
    }
}
