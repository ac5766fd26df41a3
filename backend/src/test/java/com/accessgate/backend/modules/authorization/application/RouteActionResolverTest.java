package com.accessgate.backend.modules.authorization.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Optional;

import com.accessgate.backend.modules.authorization.domain.ActionResolution;
import com.accessgate.backend.modules.permission.application.PermissionCatalog;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RouteActionResolverTest {

    @Mock
    private PermissionCatalog permissionCatalog;

    @InjectMocks
    private RouteActionResolver resolver;

    @Test
    void catalogEntryWinsOverConvention() {
        when(permissionCatalog.resolveAction("GET", "/users")).thenReturn(Optional.of("users:browse"));

        ActionResolution resolution = resolver.resolve("GET", "/api/v1/users?page=1");

        assertThat(resolution.action()).isEqualTo("users:browse");
        assertThat(resolution.source()).isEqualTo(ActionResolution.Source.CATALOG);
    }

    @Test
    void routeTemplateIsTriedAfterConcretePath() {
        when(permissionCatalog.resolveAction("GET", "/roles/9")).thenReturn(Optional.empty());
        when(permissionCatalog.resolveAction("GET", "/roles/:id")).thenReturn(Optional.of("roles:detail"));

        ActionResolution resolution = resolver.resolve("GET", "/api/v1/roles/9", "/api/v1/roles/:id");

        assertThat(resolution).isEqualTo(ActionResolution.fromCatalog("roles:detail"));
        verify(permissionCatalog, never()).resolveAction("GET", "roles/9");
    }

    @Test
    void fallsBackToNamingConvention() {
        ActionResolution resolution = resolver.resolve("DELETE", "/api/v1/reports/12");

        assertThat(resolution).isEqualTo(ActionResolution.fromConvention("reports:delete"));
        verify(permissionCatalog).resolveAction("DELETE", "/reports/12");
        verify(permissionCatalog).resolveAction("DELETE", "reports/12");
    }

    @Test
    void rootPathHasSingleCandidate() {
        assertThat(RouteActionResolver.candidatePaths("/", null)).containsExactly("/");
        verify(permissionCatalog, never()).resolveAction(anyString(), anyString());
    }

    @Test
    void candidatePathsAreDeduplicatedInOrder() {
        assertThat(RouteActionResolver.candidatePaths("/users/5", "/api/v1/users/:id"))
                .containsExactly("/users/5", "/users/:id", "users/5");
        assertThat(RouteActionResolver.candidatePaths("/users", "/users"))
                .containsExactly("/users", "users");
    }
}
