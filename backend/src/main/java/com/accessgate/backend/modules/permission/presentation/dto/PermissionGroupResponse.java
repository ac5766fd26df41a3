package com.accessgate.backend.modules.permission.presentation.dto;

import java.util.List;

public record PermissionGroupResponse(String module, int count, List<PermissionResponse> permissions) {
}
