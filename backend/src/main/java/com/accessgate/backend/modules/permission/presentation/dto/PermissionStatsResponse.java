package com.accessgate.backend.modules.permission.presentation.dto;

import java.util.List;
import java.util.Map;

import com.accessgate.backend.modules.permission.domain.PermissionUsage;

public record PermissionStatsResponse(
        long totalPermissions,
        Map<String, Long> permissionsByMethod,
        Map<String, Long> permissionsByModule,
        long unusedPermissions,
        List<PermissionUsage> mostUsedPermissions,
        List<PermissionUsage> leastUsedPermissions
) {
}
