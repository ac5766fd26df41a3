package com.accessgate.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

public record CreateInvitationRequest(
        @Min(value = 1, message = "expiresInHours must be at least 1")
        @Max(value = 720, message = "expiresInHours must be at most 720")
        Integer expiresInHours
) {
    public static final int DEFAULT_EXPIRY_HOURS = 24;

    public int expiresInHoursOrDefault() {
        return expiresInHours == null ? DEFAULT_EXPIRY_HOURS : expiresInHours;
    }
}
