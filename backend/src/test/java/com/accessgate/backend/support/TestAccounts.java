package com.accessgate.backend.support;

import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;

import com.accessgate.backend.modules.auth.application.AuthService;
import com.accessgate.backend.modules.auth.presentation.dto.RegisterRequest;
import com.accessgate.backend.modules.permission.application.PermissionCatalog;
import com.accessgate.backend.modules.permission.domain.Permission;
import com.accessgate.backend.modules.role.application.PrincipalRoleService;
import com.accessgate.backend.modules.role.application.RolePermissionGraph;
import com.accessgate.backend.modules.role.application.RoleService;
import com.accessgate.backend.modules.role.domain.Role;

import org.springframework.stereotype.Component;

/**
 * Creates principals, roles and grants through the application services so integration tests exercise the same
 * validation as the API.
 */
@Component
public class TestAccounts {

    public static final String PASSWORD = "integration-pass-1";

    private final AuthService authService;
    private final RoleService roleService;
    private final RolePermissionGraph rolePermissionGraph;
    private final PermissionCatalog permissionCatalog;
    private final PrincipalRoleService principalRoleService;

    public TestAccounts(
            AuthService authService,
            RoleService roleService,
            RolePermissionGraph rolePermissionGraph,
            PermissionCatalog permissionCatalog,
            PrincipalRoleService principalRoleService
    ) {
        this.authService = authService;
        this.roleService = roleService;
        this.rolePermissionGraph = rolePermissionGraph;
        this.permissionCatalog = permissionCatalog;
        this.principalRoleService = principalRoleService;
    }

    public Account register() {
        String email = "user-" + UUID.randomUUID() + "@example.com";
        UUID id = authService.register(new RegisterRequest(email, PASSWORD, "Test", "User", null)).id();
        return new Account(id, email);
    }

    public Role createRole(String prefix) {
        return roleService.createRole(prefix + "_" + randomLetters(8), "integration test role");
    }

    public void grant(Role role, String method, String route, String action) {
        Permission permission = permissionCatalog.registerInternalPermission(method, route, action);
        rolePermissionGraph.grant(role.getId(), permission.getId());
    }

    public void assign(Account account, Role role) {
        principalRoleService.assignRole(account.id(), role.getId(), null);
    }

    public void unassign(Account account, Role role) {
        principalRoleService.removeRole(account.id(), role.getId());
    }

    private static String randomLetters(int length) {
        StringBuilder builder = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            builder.append((char) ('A' + ThreadLocalRandom.current().nextInt(26)));
        }
        return builder.toString();
    }

    public record Account(UUID id, String email) {
    }
}
