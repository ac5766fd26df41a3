package com.accessgate.backend.modules.permission.presentation.dto;

import java.util.UUID;

public record ValidatePermissionResponse(UUID userId, String method, String action, boolean allowed) {
}
