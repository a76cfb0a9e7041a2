package com.ranco.auth.global.security;

import java.util.UUID;

import com.ranco.auth.modules.account.domain.AccountRole;

public record JwtAuthenticationPrincipal(UUID accountId, AccountRole role) {

    public String authority() {
        return "ROLE_" + role.name();
    }
}
