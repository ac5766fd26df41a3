package com.accessgate.backend.modules.principal.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.accessgate.backend.modules.principal.domain.Principal;

public record PrincipalProfileResponse(
        UUID id,
        String email,
        String firstName,
        String lastName,
        boolean active,
        List<String> roles,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {
    public static PrincipalProfileResponse from(Principal principal) {
        return new PrincipalProfileResponse(
                principal.getExternalId(),
                principal.getEmail(),
                principal.getFirstName(),
                principal.getLastName(),
                principal.isActive(),
                List.copyOf(principal.roleNames()),
                principal.getCreatedAt(),
                principal.getUpdatedAt()
        );
    }
}
