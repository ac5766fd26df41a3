package com.accessgate.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record LogoutRequest(
        @NotBlank(message = "accessToken is required") String accessToken,
        String refreshToken
) {
}
