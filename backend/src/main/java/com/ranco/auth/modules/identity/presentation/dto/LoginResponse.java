package com.ranco.auth.modules.identity.presentation.dto;

public record LoginResponse(TokenPairResponse tokens, AccountSummaryResponse account) {
}
