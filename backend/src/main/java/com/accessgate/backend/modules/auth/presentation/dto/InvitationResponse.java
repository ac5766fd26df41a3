package com.accessgate.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.accessgate.backend.modules.auth.domain.InvitationToken;

public record InvitationResponse(
        String token,
        UUID createdBy,
        OffsetDateTime expiresAt,
        boolean used,
        UUID usedBy,
        OffsetDateTime usedAt,
        OffsetDateTime createdAt
) {
    public static InvitationResponse from(InvitationToken invitation) {
        return new InvitationResponse(
                invitation.getToken(),
                invitation.getCreatedBy().getExternalId(),
                invitation.getExpiresAt(),
                invitation.isUsed(),
                invitation.getUsedBy() == null ? null : invitation.getUsedBy().getExternalId(),
                invitation.getUsedAt(),
                invitation.getCreatedAt()
        );
    }
}
