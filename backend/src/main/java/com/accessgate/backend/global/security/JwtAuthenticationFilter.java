package com.accessgate.backend.global.security;

import java.io.IOException;
import java.util.List;

import com.accessgate.backend.global.error.ProblemException;
import com.accessgate.backend.modules.authorization.application.AuthorizationDecisionEngine;
import com.accessgate.backend.modules.authorization.domain.AuthenticatedPrincipal;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * The authenticate step: verifies the bearer access token and stores the principal in the security context.
 * Requests without a bearer header pass through and are rejected later if the route requires authentication.
 */
@Component
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(JwtAuthenticationFilter.class);
    private static final String BEARER_PREFIX = "Bearer ";
    private static final String INTERNAL_ERROR_DETAIL = "An unexpected error occurred";

    private final AuthorizationDecisionEngine decisionEngine;
    private final ProblemResponseWriter problemResponseWriter;

    public JwtAuthenticationFilter(AuthorizationDecisionEngine decisionEngine, ProblemResponseWriter problemResponseWriter) {
        this.decisionEngine = decisionEngine;
        this.problemResponseWriter = problemResponseWriter;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String authorization = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authorization != null && authorization.startsWith(BEARER_PREFIX)) {
            String token = authorization.substring(BEARER_PREFIX.length()).trim();
            try {
                AuthenticatedPrincipal principal = decisionEngine.authenticate(token);
                List<SimpleGrantedAuthority> authorities = principal.roles().stream()
                        .map(role -> new SimpleGrantedAuthority("ROLE_" + role))
                        .toList();

                UsernamePasswordAuthenticationToken authentication =
                        new UsernamePasswordAuthenticationToken(principal, token, authorities);
                authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
                SecurityContextHolder.getContext().setAuthentication(authentication);
            } catch (ProblemException ex) {
                SecurityContextHolder.clearContext();
                log.info("Rejected bearer token on {} {}: {}", request.getMethod(), request.getRequestURI(), ex.getCode());
                problemResponseWriter.write(request, response, HttpStatus.valueOf(ex.getStatusCode().value()),
                        ex.getCode(), ex.getDetailMessage());
                return;
            } catch (RuntimeException ex) {
                SecurityContextHolder.clearContext();
                log.error("Bearer token check failed on {} {}", request.getMethod(), request.getRequestURI(), ex);
                problemResponseWriter.write(request, response, HttpStatus.INTERNAL_SERVER_ERROR,
                        "internal_error", INTERNAL_ERROR_DETAIL);
                return;
            }
        }

        filterChain.doFilter(request, response);
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getServletPath();
        if (request.getMethod().equalsIgnoreCase("OPTIONS")) {
            return true;
        }
        return SecurityConfig.isPublicPath(path);
    }
}
