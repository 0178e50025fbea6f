package com.facilitydesk.backend.global.security;

import java.io.IOException;
import java.util.List;

import com.facilitydesk.backend.global.error.ProblemException;
import com.facilitydesk.backend.global.error.ProblemResponse;
import com.facilitydesk.backend.modules.auth.application.AuthorizationGate;

import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Runs the authorization gate for every non-public request and writes gate rejections as problem responses.
 */
@Component
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(JwtAuthenticationFilter.class);

    static final List<String> PUBLIC_PATHS = List.of(
            "/auth/login",
            "/auth/refresh",
            "/auth/forgot-password"
    );
    static final List<String> PUBLIC_PREFIXES = List.of(
            "/auth/verify-email/",
            "/auth/reset-password/",
            "/actuator/health",
            "/v3/api-docs",
            "/swagger-ui"
    );
    static final String OPTIONAL_AUTH_PATH = "/auth/session";

    private final AuthorizationGate authorizationGate;
    private final ObjectMapper objectMapper;

    public JwtAuthenticationFilter(AuthorizationGate authorizationGate, ObjectMapper objectMapper) {
        this.authorizationGate = authorizationGate;
        this.objectMapper = objectMapper;
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        String authorization = request.getHeader(HttpHeaders.AUTHORIZATION);

        if (OPTIONAL_AUTH_PATH.equals(pathOf(request))) {
            authorizationGate.authenticateOptionally(authorization)
                    .ifPresent(principal -> attach(principal, request));
            filterChain.doFilter(request, response);
            return;
        }

        AuthenticatedPrincipal principal;
        try {
            principal = authorizationGate.authenticate(authorization);
        } catch (ProblemException ex) {
            SecurityContextHolder.clearContext();
            writeProblem(response, ProblemResponse.from(ex, request.getRequestURI()));
            return;
        } catch (RuntimeException ex) {
            SecurityContextHolder.clearContext();
            log.error("Authentication failed on {} {}", request.getMethod(), request.getRequestURI(), ex);
            writeProblem(response, ProblemResponse.of(HttpStatus.INTERNAL_SERVER_ERROR,
                    "authentication_failed", "Authentication failed", request.getRequestURI()));
            return;
        }
        attach(principal, request);
        filterChain.doFilter(request, response);
    }

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
        if (request.getMethod().equalsIgnoreCase("OPTIONS")) {
            return true;
        }
        String path = pathOf(request);
        if (PUBLIC_PATHS.contains(path)) {
            return true;
        }
        return PUBLIC_PREFIXES.stream().anyMatch(path::startsWith);
    }

    private static String pathOf(HttpServletRequest request) {
        String uri = request.getRequestURI();
        String contextPath = request.getContextPath();
        return contextPath != null && !contextPath.isEmpty() && uri.startsWith(contextPath)
                ? uri.substring(contextPath.length())
                : uri;
    }

    private void attach(AuthenticatedPrincipal principal, HttpServletRequest request) {
        List<SimpleGrantedAuthority> authorities = List.of(new SimpleGrantedAuthority("ROLE_" + principal.role().name()));
        UsernamePasswordAuthenticationToken authentication =
                new UsernamePasswordAuthenticationToken(principal, principal.token(), authorities);
        authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
        SecurityContextHolder.getContext().setAuthentication(authentication);
    }

    private void writeProblem(HttpServletResponse response, ProblemResponse body) throws IOException {
        response.setStatus(body.status());
        response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
        response.getWriter().write(objectMapper.writeValueAsString(body));
    }
}
