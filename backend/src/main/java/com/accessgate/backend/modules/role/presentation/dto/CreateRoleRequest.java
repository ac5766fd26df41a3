package com.accessgate.backend.modules.role.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateRoleRequest(
        @NotBlank(message = "name is required") @Size(max = 50, message = "name must be at most 50 characters") String name,
        @Size(max = 255, message = "description must be at most 255 characters") String description
) {
}
