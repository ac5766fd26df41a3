package com.accessgate.backend.modules.permission.presentation.dto;

import java.util.UUID;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record ValidatePermissionRequest(
        @NotNull(message = "userId is required") UUID userId,
        @NotBlank(message = "method is required") String method,
        @NotBlank(message = "action is required") String action
) {
}
