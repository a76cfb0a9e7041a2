package com.ranco.auth.modules.identity.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record ProviderLoginRequest(
        @NotBlank(message = "assertion is required") String assertion
) {
}
