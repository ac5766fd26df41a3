package com.accessgate.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ResetPasswordRequest(
        @NotBlank(message = "token is required") String token,
        @NotBlank(message = "newPassword is required") @Size(min = 8, max = 100, message = "newPassword must be 8-100 characters") String newPassword
) {
}
