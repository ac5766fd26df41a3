package com.accessgate.backend.modules.role.presentation.dto;

public record AssignPermissionsResponse(Long roleId, int assigned, boolean replaced) {
}
