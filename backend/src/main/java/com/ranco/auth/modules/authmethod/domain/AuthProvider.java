package com.ranco.auth.modules.authmethod.domain;

import java.util.Locale;

/**
 * Supported credential providers. EMAIL proves control through one-time codes; the others
 * are OAuth-class providers whose assertion is checked by the provider itself.
 */
public enum AuthProvider {
    EMAIL(true),
    GOOGLE(false);

    private final boolean codeVerified;

    AuthProvider(boolean codeVerified) {
        this.codeVerified = codeVerified;
    }

    public boolean usesVerificationCode() {
        return codeVerified;
    }

    public static AuthProvider fromCode(String code) {
        if (code == null) {
            throw new IllegalArgumentException("provider is required");
        }
        return AuthProvider.valueOf(code.trim().toUpperCase(Locale.ROOT));
    }
}
