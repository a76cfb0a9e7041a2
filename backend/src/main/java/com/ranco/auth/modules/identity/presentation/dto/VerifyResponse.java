package com.ranco.auth.modules.identity.presentation.dto;

/**
 * {@code tokens} is null when verification does not start a session.
 */
public record VerifyResponse(AccountSummaryResponse account, TokenPairResponse tokens) {
}
