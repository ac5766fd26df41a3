package com.accessgate.backend.modules.role.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.accessgate.backend.global.error.ProblemException;
import com.accessgate.backend.modules.permission.domain.Permission;
import com.accessgate.backend.modules.permission.infrastructure.persistence.PermissionRepository;
import com.accessgate.backend.modules.role.domain.Role;
import com.accessgate.backend.modules.role.domain.RolePermission;
import com.accessgate.backend.modules.role.infrastructure.persistence.RolePermissionRepository;
import com.accessgate.backend.modules.role.infrastructure.persistence.RoleRepository;
import com.accessgate.backend.support.TestPrincipals;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class RolePermissionGraphTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T09:00:00Z"), ZoneOffset.UTC);
    private static final OffsetDateTime NOW = OffsetDateTime.now(CLOCK);

    @Mock
    private RoleRepository roleRepository;

    @Mock
    private PermissionRepository permissionRepository;

    @Mock
    private RolePermissionRepository rolePermissionRepository;

    private RolePermissionGraph graph;

    @BeforeEach
    void setUp() {
        graph = new RolePermissionGraph(roleRepository, permissionRepository, rolePermissionRepository, CLOCK);
    }

    @Test
    @DisplayName("an empty role set is denied without a query")
    void emptyRolesAreNeverAuthorized() {
        assertThat(graph.isAuthorized(List.of(), "GET", "users:list")).isFalse();
        assertThat(graph.isAuthorized(null, "GET", "users:list")).isFalse();
        assertThat(graph.effectivePermissions(Set.of())).isEmpty();

        verifyNoInteractions(rolePermissionRepository);
    }

    @Test
    void authorizationMatchesNormalizedMethod() {
        List<String> roles = List.of("ADMIN");
        when(rolePermissionRepository.existsAuthorized(roles, "GET", "users:list")).thenReturn(true);

        assertThat(graph.isAuthorized(roles, "get", "users:list")).isTrue();
    }

    @Test
    void grantIsIdempotent() {
        Role role = TestPrincipals.role(1L, "EDITOR");
        Permission permission = permission(2L, "roles:list");
        when(roleRepository.findById(1L)).thenReturn(Optional.of(role));
        when(permissionRepository.findById(2L)).thenReturn(Optional.of(permission));
        when(rolePermissionRepository.insertGrantIfAbsent(1L, 2L, NOW)).thenReturn(1, 0);

        assertThat(graph.grant(1L, 2L)).isTrue();
        assertThat(graph.grant(1L, 2L)).isFalse();

        verify(rolePermissionRepository, times(2)).insertGrantIfAbsent(1L, 2L, NOW);
        verify(rolePermissionRepository, never()).save(any(RolePermission.class));
    }

    @Test
    void grantFailsForUnknownRole() {
        assertThatThrownBy(() -> graph.grant(404L, 2L))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
                    assertThat(ex.getCode()).isEqualTo("ROLE_NOT_FOUND");
                });
    }

    @Test
    @DisplayName("replace validates every id before writing anything")
    void replaceRejectsUnknownPermissionsUpFront() {
        when(roleRepository.findById(1L)).thenReturn(Optional.of(TestPrincipals.role(1L, "EDITOR")));
        when(permissionRepository.findAllById(Set.of(1L, 2L))).thenReturn(List.of(permission(1L, "roles:list")));

        assertThatThrownBy(() -> graph.replace(1L, List.of(1L, 2L), true))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
                    assertThat(ex.getCode()).isEqualTo("PERMISSION_NOT_FOUND");
                });

        verify(rolePermissionRepository, never()).deleteAllGrants(anyLong());
        verify(rolePermissionRepository, never()).insertGrantIfAbsent(anyLong(), anyLong(), any());
    }

    @Test
    void replaceClearsExistingGrants() {
        when(roleRepository.findById(1L)).thenReturn(Optional.of(TestPrincipals.role(1L, "EDITOR")));
        when(permissionRepository.findAllById(Set.of(1L, 2L)))
                .thenReturn(List.of(permission(1L, "roles:list"), permission(2L, "roles:detail")));

        when(rolePermissionRepository.insertGrantIfAbsent(1L, 1L, NOW)).thenReturn(1);
        when(rolePermissionRepository.insertGrantIfAbsent(1L, 2L, NOW)).thenReturn(1);

        int written = graph.replace(1L, List.of(1L, 2L, 2L), true);

        assertThat(written).isEqualTo(2);
        verify(rolePermissionRepository).deleteAllGrants(1L);
        verify(rolePermissionRepository, times(1)).insertGrantIfAbsent(1L, 2L, NOW);
    }

    @Test
    void additiveAssignSkipsExistingGrants() {
        when(roleRepository.findById(1L)).thenReturn(Optional.of(TestPrincipals.role(1L, "EDITOR")));
        when(permissionRepository.findAllById(Set.of(1L, 2L)))
                .thenReturn(List.of(permission(1L, "roles:list"), permission(2L, "roles:detail")));
        when(rolePermissionRepository.insertGrantIfAbsent(1L, 1L, NOW)).thenReturn(0);
        when(rolePermissionRepository.insertGrantIfAbsent(1L, 2L, NOW)).thenReturn(1);

        assertThat(graph.replace(1L, List.of(1L, 2L), false)).isEqualTo(1);
        verify(rolePermissionRepository, never()).deleteAllGrants(anyLong());
    }

    @Test
    void revokeWithNoIdsIsNoop() {
        when(roleRepository.findById(1L)).thenReturn(Optional.of(TestPrincipals.role(1L, "EDITOR")));

        assertThat(graph.revoke(1L, List.of())).isZero();
        verifyNoInteractions(rolePermissionRepository);
    }

    @Test
    void missingAssignmentIsNotFound() {
        assertThatThrownBy(() -> graph.findAssignment(12L))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("ROLE_PERMISSION_NOT_FOUND"));
    }

    private static Permission permission(Long id, String action) {
        Permission permission = new Permission("GET", "/" + action.replace(':', '/'), action);
        ReflectionTestUtils.setField(permission, "id", id);
        return permission;
    }
}
