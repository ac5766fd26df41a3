package com.accessgate.backend.modules.permission.presentation.dto;

import java.time.OffsetDateTime;

import com.accessgate.backend.modules.permission.domain.Permission;

public record PermissionResponse(
        Long id,
        String method,
        String route,
        String action,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {
    public static PermissionResponse from(Permission permission) {
        return new PermissionResponse(
                permission.getId(),
                permission.getMethod(),
                permission.getRoute(),
                permission.getAction(),
                permission.getCreatedAt(),
                permission.getUpdatedAt()
        );
    }
}
