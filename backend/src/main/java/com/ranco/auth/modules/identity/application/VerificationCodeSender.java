package com.ranco.auth.modules.identity.application;

import com.ranco.auth.modules.authmethod.domain.AuthProvider;
import com.ranco.auth.modules.verification.domain.IssuedCode;

/**
 * Out-of-band delivery of a plaintext verification code to the holder of an auth method.
 */
public interface VerificationCodeSender {

    void send(AuthProvider provider, String externalId, IssuedCode code);
}
