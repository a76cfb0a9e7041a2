package com.ranco.auth.modules.identity.application;

import com.ranco.auth.modules.authmethod.domain.AuthProvider;

/**
 * Checks a provider-issued assertion (an ID token, for instance) and returns the provider's
 * stable subject for the caller. Any failure must surface as {@code INVALID_CREDENTIALS}.
 */
public interface ProviderAssertionVerifier {

    AuthProvider provider();

    String verifySubject(String assertion);
}
