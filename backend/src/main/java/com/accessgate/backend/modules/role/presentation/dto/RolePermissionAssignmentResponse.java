package com.accessgate.backend.modules.role.presentation.dto;

import java.time.OffsetDateTime;

import com.accessgate.backend.modules.permission.presentation.dto.PermissionResponse;
import com.accessgate.backend.modules.role.domain.RolePermission;

public record RolePermissionAssignmentResponse(
        Long id,
        RoleResponse role,
        PermissionResponse permission,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {
    public static RolePermissionAssignmentResponse from(RolePermission assignment) {
        return new RolePermissionAssignmentResponse(
                assignment.getId(),
                RoleResponse.from(assignment.getRole()),
                PermissionResponse.from(assignment.getPermission()),
                assignment.getCreatedAt(),
                assignment.getUpdatedAt()
        );
    }
}
