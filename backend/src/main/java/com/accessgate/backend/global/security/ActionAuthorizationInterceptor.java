package com.accessgate.backend.global.security;

import java.util.regex.Pattern;

import com.accessgate.backend.modules.authorization.application.AuthorizationDecisionEngine;
import com.accessgate.backend.modules.authorization.domain.ActionResolution;
import com.accessgate.backend.modules.authorization.domain.AuthenticatedPrincipal;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.stereotype.Component;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.HandlerMapping;

/**
 * The authorize step. Runs after authentication, so a missing principal here is a 401, a denied action a 403.
 */
@Component
public class ActionAuthorizationInterceptor implements HandlerInterceptor {

    public static final String RESOLVED_ACTION_ATTRIBUTE = ActionAuthorizationInterceptor.class.getName() + ".action";

    private static final Pattern TEMPLATE_VARIABLE = Pattern.compile("\\{([^}/:]+)(?::[^}]*)?}");

    private final AuthorizationDecisionEngine decisionEngine;

    public ActionAuthorizationInterceptor(AuthorizationDecisionEngine decisionEngine) {
        this.decisionEngine = decisionEngine;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (!(handler instanceof HandlerMethod handlerMethod) || !requiresAuthorization(handlerMethod)) {
            return true;
        }

        AuthenticatedPrincipal principal = SecurityUtils.getCurrentPrincipal();
        String path = request.getRequestURI().substring(request.getContextPath().length());
        ActionResolution resolution = decisionEngine.authorize(principal, request.getMethod(), path, routeTemplate(request));
        request.setAttribute(RESOLVED_ACTION_ATTRIBUTE, resolution.action());
        return true;
    }

    private static boolean requiresAuthorization(HandlerMethod handlerMethod) {
        return handlerMethod.hasMethodAnnotation(AuthorizeAction.class)
                || AnnotatedElementUtils.hasAnnotation(handlerMethod.getBeanType(), AuthorizeAction.class);
    }

    /**
     * Converts Spring's {@code /roles/{id}} template into the catalog's {@code /roles/:id} form.
     */
    static String toCatalogRoute(String template) {
        if (template == null) {
            return null;
        }
        return TEMPLATE_VARIABLE.matcher(template).replaceAll(":$1");
    }

    private static String routeTemplate(HttpServletRequest request) {
        Object pattern = request.getAttribute(HandlerMapping.BEST_MATCHING_PATTERN_ATTRIBUTE);
        return pattern == null ? null : toCatalogRoute(pattern.toString());
    }
}
