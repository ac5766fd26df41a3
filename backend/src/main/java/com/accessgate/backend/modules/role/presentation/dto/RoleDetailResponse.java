package com.accessgate.backend.modules.role.presentation.dto;

public record RoleDetailResponse(RoleResponse role, long permissionCount, long userCount) {
}
