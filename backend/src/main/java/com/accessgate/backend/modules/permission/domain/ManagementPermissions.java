package com.accessgate.backend.modules.permission.domain;

import java.util.List;

/**
 * Permissions protecting the service's own management endpoints, granted to ADMIN at bootstrap.
 */
public final class ManagementPermissions {

    public static final List<Definition> ALL = List.of(
            new Definition("GET", "/users", "user:list"),

            new Definition("GET", "/roles", "role:list"),
            new Definition("GET", "/roles/:id", "role:detail"),
            new Definition("POST", "/roles", "role:create"),
            new Definition("PUT", "/roles/:id", "role:update"),
            new Definition("DELETE", "/roles/:id", "role:delete"),
            new Definition("GET", "/roles/:id/users", "role:users"),

            new Definition("GET", "/permissions", "permission:list"),
            new Definition("GET", "/permissions/:id", "permission:detail"),
            new Definition("POST", "/permissions", "permission:create"),
            new Definition("DELETE", "/permissions/:id", "permission:delete"),
            new Definition("GET", "/permissions/:id/roles", "permission:roles"),
            new Definition("GET", "/permissions/grouped", "permission:grouped"),
            new Definition("GET", "/permissions/routes", "permission:routes"),
            new Definition("GET", "/permissions/stats", "permission:stats"),
            new Definition("GET", "/permissions/unused", "permission:unused"),
            new Definition("GET", "/permissions/usage", "permission:usage"),
            new Definition("GET", "/permissions/resolve", "permission:resolve"),
            new Definition("POST", "/permissions/validate", "permission:validate"),

            new Definition("GET", "/role-permissions/:roleId/permissions", "role-permission:list"),
            new Definition("POST", "/role-permissions/:roleId/permissions", "role-permission:assign"),
            new Definition("DELETE", "/role-permissions/:roleId/permissions", "role-permission:revoke"),
            new Definition("GET", "/role-permissions/:roleId/permissions/:permissionId", "role-permission:check"),
            new Definition("PUT", "/role-permissions/:roleId/permissions/:permissionId", "role-permission:grant"),
            new Definition("GET", "/role-permissions/assignments/:id", "role-permission:detail"),
            new Definition("DELETE", "/role-permissions/assignments/:id", "role-permission:remove"),

            new Definition("GET", "/user-roles/:userId", "user-role:list"),
            new Definition("POST", "/user-roles/:userId/roles/:roleId", "user-role:assign"),
            new Definition("DELETE", "/user-roles/:userId/roles/:roleId", "user-role:remove"),

            new Definition("GET", "/invitations", "invitation:list"),
            new Definition("POST", "/invitations", "invitation:create")
    );

    private ManagementPermissions() {
    }

    public record Definition(String method, String route, String action) {
    }
}
