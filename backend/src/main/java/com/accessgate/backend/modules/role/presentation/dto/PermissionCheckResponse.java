package com.accessgate.backend.modules.role.presentation.dto;

public record PermissionCheckResponse(Long roleId, Long permissionId, boolean granted) {
}
