package com.ranco.auth.modules.verification.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Freshly issued code. The plaintext lives only here and is handed to the delivery channel.
 */
public record IssuedCode(UUID codeId, String plaintext, OffsetDateTime expiresAt) {

    @Override
    public String toString() {
        return "IssuedCode[codeId=" + codeId + ", plaintext=******, expiresAt=" + expiresAt + "]";
    }
}
