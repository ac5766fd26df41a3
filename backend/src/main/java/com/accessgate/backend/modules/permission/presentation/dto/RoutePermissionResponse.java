package com.accessgate.backend.modules.permission.presentation.dto;

import java.util.List;

public record RoutePermissionResponse(
        String route,
        String method,
        String action,
        String description,
        List<String> roles
) {
}
