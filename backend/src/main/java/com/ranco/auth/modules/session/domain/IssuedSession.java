package com.ranco.auth.modules.session.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

public record IssuedSession(UUID tokenId, String refreshToken, OffsetDateTime expiresAt) {

    @Override
    public String toString() {
        return "IssuedSession[tokenId=" + tokenId + ", refreshToken=******, expiresAt=" + expiresAt + "]";
    }
}
