package com.accessgate.backend.modules.admin.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Locale;

import com.accessgate.backend.modules.permission.application.PermissionCatalog;
import com.accessgate.backend.modules.permission.domain.ManagementPermissions;
import com.accessgate.backend.modules.principal.domain.Principal;
import com.accessgate.backend.modules.principal.infrastructure.persistence.PrincipalRepository;
import com.accessgate.backend.modules.role.application.RolePermissionGraph;
import com.accessgate.backend.modules.role.domain.Role;
import com.accessgate.backend.modules.role.domain.RoleNames;
import com.accessgate.backend.modules.role.infrastructure.persistence.PrincipalRoleRepository;
import com.accessgate.backend.modules.role.infrastructure.persistence.RolePermissionRepository;
import com.accessgate.backend.modules.role.infrastructure.persistence.RoleRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Ensures an ADMIN role, an admin principal holding it, and, when the role has no grants yet, the full set of
 * management permissions. Safe to run on every start.
 */
@Component
@ConditionalOnProperty(prefix = "app.bootstrap", name = "enabled", havingValue = "true")
public class AdminBootstrapRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(AdminBootstrapRunner.class);

    private final RoleRepository roleRepository;
    private final PrincipalRepository principalRepository;
    private final PrincipalRoleRepository principalRoleRepository;
    private final RolePermissionRepository rolePermissionRepository;
    private final PermissionCatalog permissionCatalog;
    private final RolePermissionGraph rolePermissionGraph;
    private final PasswordEncoder passwordEncoder;
    private final Clock clock;
    private final String adminEmail;
    private final String adminPassword;

    public AdminBootstrapRunner(
            RoleRepository roleRepository,
            PrincipalRepository principalRepository,
            PrincipalRoleRepository principalRoleRepository,
            RolePermissionRepository rolePermissionRepository,
            PermissionCatalog permissionCatalog,
            RolePermissionGraph rolePermissionGraph,
            PasswordEncoder passwordEncoder,
            Clock clock,
            @Value("${app.bootstrap.admin-email}") String adminEmail,
            @Value("${app.bootstrap.admin-password}") String adminPassword
    ) {
        this.roleRepository = roleRepository;
        this.principalRepository = principalRepository;
        this.principalRoleRepository = principalRoleRepository;
        this.rolePermissionRepository = rolePermissionRepository;
        this.permissionCatalog = permissionCatalog;
        this.rolePermissionGraph = rolePermissionGraph;
        this.passwordEncoder = passwordEncoder;
        this.clock = clock;
        this.adminEmail = adminEmail;
        this.adminPassword = adminPassword;
    }

    @Override
    @Transactional
    public void run(ApplicationArguments args) {
        Role adminRole = roleRepository.findByName(RoleNames.ADMIN).orElseGet(this::createAdminRole);
        Principal admin = principalRepository.findByEmailIgnoreCase(adminEmail).orElseGet(this::createAdminPrincipal);

        if (principalRoleRepository.insertAssignmentIfAbsent(admin.getId(), adminRole.getId(), OffsetDateTime.now(clock)) > 0) {
            log.info("Assigned ADMIN role to {}", adminEmail);
        }

        if (rolePermissionRepository.countGrants(adminRole.getId()) == 0) {
            List<Long> permissionIds = ManagementPermissions.ALL.stream()
                    .map(definition -> permissionCatalog.registerInternalPermission(
                            definition.method(), definition.route(), definition.action()).getId())
                    .toList();
            int granted = rolePermissionGraph.replace(adminRole.getId(), permissionIds, false);
            log.info("Granted {} management permissions to ADMIN", granted);
        }
    }

    private Role createAdminRole() {
        Role role = new Role();
        role.setName(RoleNames.ADMIN);
        role.setDescription("Full administrative access");
        log.info("Creating ADMIN role");
        return roleRepository.save(role);
    }

    private Principal createAdminPrincipal() {
        Principal principal = new Principal();
        principal.setEmail(adminEmail.trim().toLowerCase(Locale.ROOT));
        principal.setFirstName("System");
        principal.setLastName("Administrator");
        principal.setPasswordHash(passwordEncoder.encode(adminPassword));
        log.info("Creating bootstrap admin {}", adminEmail);
        return principalRepository.save(principal);
    }
}
