package com.accessgate.backend.modules.role.presentation.dto;

import java.util.List;

import jakarta.validation.constraints.NotNull;

public record AssignPermissionsRequest(
        @NotNull(message = "permissionIds is required") List<Long> permissionIds,
        boolean replace
) {
}
