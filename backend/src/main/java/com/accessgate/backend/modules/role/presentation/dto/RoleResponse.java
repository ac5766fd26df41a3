package com.accessgate.backend.modules.role.presentation.dto;

import java.time.OffsetDateTime;

import com.accessgate.backend.modules.role.domain.Role;

public record RoleResponse(Long id, String name, String description, OffsetDateTime createdAt, OffsetDateTime updatedAt) {

    public static RoleResponse from(Role role) {
        return new RoleResponse(role.getId(), role.getName(), role.getDescription(), role.getCreatedAt(), role.getUpdatedAt());
    }
}
