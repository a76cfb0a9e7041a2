package com.ranco.auth.modules.identity.presentation.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record EmailRequest(
        @NotBlank(message = "email is required") @Email(message = "email must be a valid address") @Size(max = 255) String email
) {
}
