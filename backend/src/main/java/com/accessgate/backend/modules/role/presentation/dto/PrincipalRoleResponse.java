package com.accessgate.backend.modules.role.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.accessgate.backend.modules.role.domain.PrincipalRole;

public record PrincipalRoleResponse(
        Long id,
        UUID userId,
        String userEmail,
        Long roleId,
        String roleName,
        OffsetDateTime assignedAt,
        UUID assignedBy
) {
    public static PrincipalRoleResponse from(PrincipalRole assignment) {
        return new PrincipalRoleResponse(
                assignment.getId(),
                assignment.getPrincipal().getExternalId(),
                assignment.getPrincipal().getEmail(),
                assignment.getRole().getId(),
                assignment.getRole().getName(),
                assignment.getAssignedAt(),
                assignment.getAssignedBy() == null ? null : assignment.getAssignedBy().getExternalId()
        );
    }
}
