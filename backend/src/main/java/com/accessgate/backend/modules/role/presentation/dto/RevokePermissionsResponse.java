package com.accessgate.backend.modules.role.presentation.dto;

public record RevokePermissionsResponse(Long roleId, int revoked) {
}
