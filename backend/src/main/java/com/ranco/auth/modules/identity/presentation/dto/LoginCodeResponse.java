package com.ranco.auth.modules.identity.presentation.dto;

import java.time.OffsetDateTime;

public record LoginCodeResponse(long expiresIn, OffsetDateTime expiresAt) {
}
