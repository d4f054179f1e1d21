package com.polysearch.search.security;

import com.auth0.jwt.JWT;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.interfaces.DecodedJWT;
import com.auth0.jwt.interfaces.JWTVerifier;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Optional bearer-token check in front of {@code /search} and {@code /suggest}.
 */
@Component
public class SearchAuthorizationFilter extends OncePerRequestFilter {

    private final boolean jwtEnabled;
    private final JWTVerifier jwtVerifier;

    public SearchAuthorizationFilter(
            @Value("${polysearch.auth.jwt.enabled:false}") boolean jwtEnabled,
            @Value("${polysearch.auth.jwt.secret:}") String jwtSecret,
            @Value("${polysearch.auth.jwt.issuer:}") String jwtIssuer
    ) {
        this.jwtEnabled = jwtEnabled;
        if (!jwtEnabled) {
            this.jwtVerifier = null;
            return;
        }
        if (jwtSecret == null || jwtSecret.isBlank()) {
            throw new IllegalArgumentException("polysearch.auth.jwt.secret is required when JWT auth is enabled");
        }
        Algorithm algorithm = Algorithm.HMAC256(jwtSecret);
        this.jwtVerifier = (jwtIssuer == null || jwtIssuer.isBlank())
                ? JWT.require(algorithm).build()
                : JWT.require(algorithm).withIssuer(jwtIssuer).build();
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        String path = request.getRequestURI().substring(request.getContextPath().length());
        String requiredPermission = requiredPermission(path);
        if (!jwtEnabled || requiredPermission == null) {
            chain.doFilter(request, response);
            return;
        }

        String authHeader = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authHeader == null || !authHeader.startsWith("Bearer ")) {
            reject(response, HttpStatus.UNAUTHORIZED, "Missing or invalid Authorization header");
            return;
        }
        String token = authHeader.substring("Bearer ".length()).trim();
        if (token.isBlank()) {
            reject(response, HttpStatus.UNAUTHORIZED, "JWT token is empty");
            return;
        }

        DecodedJWT jwt;
        try {
            jwt = jwtVerifier.verify(token);
        } catch (Exception ex) {
            reject(response, HttpStatus.UNAUTHORIZED, "JWT validation failed");
            return;
        }
        if (!extractPermissions(jwt).contains(requiredPermission)) {
            reject(response, HttpStatus.FORBIDDEN, "Insufficient scope/role for route");
            return;
        }
        chain.doFilter(request, response);
    }

    static String requiredPermission(String path) {
        if (path.startsWith("/search")) {
            return "search:read";
        }
        if (path.startsWith("/suggest")) {
            return "suggest:read";
        }
        return null;
    }

    private static Set<String> extractPermissions(DecodedJWT jwt) {
        Set<String> permissions = new HashSet<>();
        String scope = jwt.getClaim("scope").asString();
        if (scope != null && !scope.isBlank()) {
            for (String s : scope.split("\\s+")) {
                if (!s.isBlank()) {
                    permissions.add(s.trim());
                }
            }
        }

        List<String> scopes = jwt.getClaim("scopes").asList(String.class);
        if (scopes != null) {
            permissions.addAll(scopes);
        }

        List<String> roles = jwt.getClaim("roles").asList(String.class);
        if (roles != null) {
            permissions.addAll(roles);
        }
        return permissions;
    }

    private static void reject(HttpServletResponse response, HttpStatus status, String reason) {
        response.setStatus(status.value());
        response.addHeader("X-Auth-Error", reason);
    }
}
