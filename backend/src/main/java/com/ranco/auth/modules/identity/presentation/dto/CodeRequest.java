package com.ranco.auth.modules.identity.presentation.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record CodeRequest(
        @NotBlank(message = "email is required") @Email(message = "email must be a valid address") @Size(max = 255) String email,
        @NotBlank(message = "code is required") @Pattern(regexp = "\\d{4,10}", message = "code must be numeric") String code
) {
}
