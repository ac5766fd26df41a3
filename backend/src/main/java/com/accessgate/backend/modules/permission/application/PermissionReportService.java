package com.accessgate.backend.modules.permission.application;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.accessgate.backend.modules.permission.domain.Permission;
import com.accessgate.backend.modules.permission.domain.PermissionUsage;
import com.accessgate.backend.modules.permission.infrastructure.persistence.PermissionRepository;
import com.accessgate.backend.modules.permission.presentation.dto.PermissionGroupResponse;
import com.accessgate.backend.modules.permission.presentation.dto.PermissionResponse;
import com.accessgate.backend.modules.permission.presentation.dto.PermissionStatsResponse;
import com.accessgate.backend.modules.permission.presentation.dto.RoutePermissionResponse;
import com.accessgate.backend.modules.role.infrastructure.persistence.RolePermissionRepository;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Read-only views over the catalog used by administrators to audit which routes are protected and by whom.
 */
@Service
@Transactional(readOnly = true)
public class PermissionReportService {

    private static final int TOP_USAGE_LIMIT = 10;

    private final PermissionRepository permissionRepository;
    private final RolePermissionRepository rolePermissionRepository;

    public PermissionReportService(
            PermissionRepository permissionRepository,
            RolePermissionRepository rolePermissionRepository
    ) {
        this.permissionRepository = permissionRepository;
        this.rolePermissionRepository = rolePermissionRepository;
    }

    public List<PermissionGroupResponse> groupedByModule() {
        Map<String, List<PermissionResponse>> grouped = new LinkedHashMap<>();
        for (Permission permission : permissionRepository.findAllByOrderByActionAsc()) {
            grouped.computeIfAbsent(permission.module(), key -> new ArrayList<>())
                    .add(PermissionResponse.from(permission));
        }
        return grouped.entrySet().stream()
                .map(entry -> new PermissionGroupResponse(entry.getKey(), entry.getValue().size(), entry.getValue()))
                .toList();
    }

    public List<RoutePermissionResponse> routeOverview() {
        return permissionRepository.findAllByOrderByRouteAscMethodAsc().stream()
                .map(permission -> new RoutePermissionResponse(
                        permission.getRoute(),
                        permission.getMethod(),
                        permission.getAction(),
                        describe(permission),
                        rolePermissionRepository.findRoleNamesOfPermission(permission.getId())
                ))
                .toList();
    }

    public List<PermissionResponse> unusedPermissions() {
        return permissionRepository.findUnused().stream()
                .map(PermissionResponse::from)
                .toList();
    }

    public List<PermissionUsage> usage() {
        return permissionRepository.findUsageByAction();
    }

    public PermissionStatsResponse stats() {
        List<Permission> permissions = permissionRepository.findAll();
        Map<String, Long> byMethod = new TreeMap<>();
        Map<String, Long> byModule = new TreeMap<>();
        for (Permission permission : permissions) {
            byMethod.merge(permission.getMethod(), 1L, Long::sum);
            byModule.merge(permission.module(), 1L, Long::sum);
        }

        List<PermissionUsage> usage = usage();
        List<PermissionUsage> mostUsed = usage.subList(0, Math.min(TOP_USAGE_LIMIT, usage.size()));
        List<PermissionUsage> leastUsed = new ArrayList<>(
                usage.subList(Math.max(0, usage.size() - TOP_USAGE_LIMIT), usage.size()));
        Collections.reverse(leastUsed);

        return new PermissionStatsResponse(
                permissions.size(),
                byMethod,
                byModule,
                permissionRepository.findUnused().size(),
                List.copyOf(mostUsed),
                leastUsed
        );
    }

    static String describe(Permission permission) {
        String resource = permission.module();
        return switch (permission.getMethod()) {
            case "GET" -> "Retrieve " + resource + " data";
            case "POST" -> "Create new " + resource;
            case "PUT", "PATCH" -> "Update " + resource + " data";
            case "DELETE" -> "Delete " + resource;
            default -> permission.getMethod() + " operation on " + resource;
        };
    }
}
