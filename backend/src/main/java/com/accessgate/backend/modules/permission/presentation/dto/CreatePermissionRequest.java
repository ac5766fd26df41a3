package com.accessgate.backend.modules.permission.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreatePermissionRequest(
        @NotBlank(message = "method is required") String method,
        @NotBlank(message = "route is required") @Size(max = 255, message = "route is too long") String route,
        @NotBlank(message = "action is required") @Size(max = 100, message = "action is too long") String action
) {
}
