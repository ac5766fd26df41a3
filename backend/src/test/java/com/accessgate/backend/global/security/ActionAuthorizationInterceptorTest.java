package com.accessgate.backend.global.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.UUID;

import com.accessgate.backend.global.error.ProblemException;
import com.accessgate.backend.modules.authorization.application.AuthorizationDecisionEngine;
import com.accessgate.backend.modules.authorization.domain.ActionResolution;
import com.accessgate.backend.modules.authorization.domain.AuthenticatedPrincipal;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerMapping;

@ExtendWith(MockitoExtension.class)
class ActionAuthorizationInterceptorTest {

    @Mock
    private AuthorizationDecisionEngine decisionEngine;

    @InjectMocks
    private ActionAuthorizationInterceptor interceptor;

    @AfterEach
    void clearContext() {
        SecurityContextHolder.clearContext();
    }

    @Test
    void convertsSpringTemplatesToCatalogRoutes() {
        assertThat(ActionAuthorizationInterceptor.toCatalogRoute("/api/v1/roles/{roleId}/permissions/{permissionId}"))
                .isEqualTo("/api/v1/roles/:roleId/permissions/:permissionId");
        assertThat(ActionAuthorizationInterceptor.toCatalogRoute("/api/v1/users/{id:\\d+}")).isEqualTo("/api/v1/users/:id");
        assertThat(ActionAuthorizationInterceptor.toCatalogRoute("/api/v1/users")).isEqualTo("/api/v1/users");
        assertThat(ActionAuthorizationInterceptor.toCatalogRoute(null)).isNull();
    }

    @Test
    void authorizesAnnotatedHandlerWithRouteTemplate() throws Exception {
        AuthenticatedPrincipal principal = authenticate("ADMIN");
        MockHttpServletRequest request = new MockHttpServletRequest("DELETE", "/api/v1/roles/5");
        request.setAttribute(HandlerMapping.BEST_MATCHING_PATTERN_ATTRIBUTE, "/api/v1/roles/{id}");
        when(decisionEngine.authorize(principal, "DELETE", "/api/v1/roles/5", "/api/v1/roles/:id"))
                .thenReturn(ActionResolution.fromCatalog("roles:delete"));

        boolean proceed = interceptor.preHandle(request, new MockHttpServletResponse(), handler("guarded"));

        assertThat(proceed).isTrue();
        assertThat(request.getAttribute(ActionAuthorizationInterceptor.RESOLVED_ACTION_ATTRIBUTE)).isEqualTo("roles:delete");
        verify(decisionEngine).authorize(principal, "DELETE", "/api/v1/roles/5", "/api/v1/roles/:id");
    }

    @Test
    void contextPathIsNotPartOfTheRoute() throws Exception {
        AuthenticatedPrincipal principal = authenticate("ADMIN");
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/gate/api/v1/users");
        request.setContextPath("/gate");
        when(decisionEngine.authorize(principal, "GET", "/api/v1/users", null))
                .thenReturn(ActionResolution.fromConvention("users:list"));

        assertThat(interceptor.preHandle(request, new MockHttpServletResponse(), handler("guarded"))).isTrue();
    }

    @Test
    void unannotatedHandlersAreSkipped() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/v1/users/profile");

        assertThat(interceptor.preHandle(request, new MockHttpServletResponse(), handler("open"))).isTrue();
        assertThat(interceptor.preHandle(request, new MockHttpServletResponse(), new Object())).isTrue();
        verifyNoInteractions(decisionEngine);
    }

    @Test
    void classLevelAnnotationAppliesToEveryHandler() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/v1/reports");
        HandlerMethod handler = new HandlerMethod(new GuardedController(), GuardedController.class.getMethod("list"));

        assertThatThrownBy(() -> interceptor.preHandle(request, new MockHttpServletResponse(), handler))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED));
    }

    private static AuthenticatedPrincipal authenticate(String... roles) {
        AuthenticatedPrincipal principal = new AuthenticatedPrincipal(UUID.randomUUID(), "admin@example.com", List.of(roles));
        SecurityContextHolder.getContext().setAuthentication(
                new UsernamePasswordAuthenticationToken(principal, "token", List.of()));
        return principal;
    }

    private static HandlerMethod handler(String name) throws NoSuchMethodException {
        return new HandlerMethod(new SampleController(), SampleController.class.getMethod(name));
    }

    static class SampleController {

        @AuthorizeAction
        public void guarded() {
        }

        public void open() {
        }
    }

    @AuthorizeAction
    static class GuardedController {

        public void list() {
        }
    }
}
