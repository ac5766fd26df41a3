package com.accessgate.backend.modules.role.presentation.dto;

import jakarta.validation.constraints.Size;

public record UpdateRoleRequest(
        @Size(max = 50, message = "name must be at most 50 characters") String name,
        @Size(max = 255, message = "description must be at most 255 characters") String description
) {
}
