package com.example.authservice.security;

import com.example.authservice.exception.GlobalExceptionHandler;
import com.example.authservice.exception.TokenInvalidException;
import com.example.authservice.exception.UpstreamUnavailableException;
import com.example.authservice.service.AuthorizationResolver;
import com.example.authservice.token.TokenClaims;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.util.AntPathMatcher;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;
import java.util.Locale;

/**
 * JWT Authentication Filter.
 *
 * Runs the {@link AuthorizationResolver} on the Bearer token of every protected
 * request. A token that fails any check ends the request with 401 (or 503 when
 * the blacklist cannot be consulted); no token at all is left to the entry point.
 *
 * Flow:
 * HTTP Request → JwtAuthenticationFilter (resolve token) → SecurityContextHolder → Controller
 */
@Component
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(JwtAuthenticationFilter.class);

    private static final String BEARER_PREFIX = "Bearer ";

    /**
     * Routes reachable without a token. Shared with the security filter chain.
     */
    public static final String[] PUBLIC_ENDPOINTS = {
            "/api/auth/login",
            "/api/auth/register",
            "/api/auth/refresh",
            "/api/auth/forgot-password",
            "/api/auth/reset-password",
            "/actuator/health",
            "/actuator/info",
            "/swagger-ui/**",
            "/swagger-ui.html",
            "/v3/api-docs/**"
    };

    private final AuthorizationResolver authorizationResolver;
    private final JsonErrorWriter errorWriter;
    private final AntPathMatcher pathMatcher = new AntPathMatcher();

    public JwtAuthenticationFilter(AuthorizationResolver authorizationResolver, JsonErrorWriter errorWriter) {
        this.authorizationResolver = authorizationResolver;
        this.errorWriter = errorWriter;
    }

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
        String path = request.getServletPath();
        for (String pattern : PUBLIC_ENDPOINTS) {
            if (pathMatcher.match(pattern, path)) {
                return true;
            }
        }
        return false;
    }

    @Override
    protected void doFilterInternal(
            @NonNull HttpServletRequest request,
            @NonNull HttpServletResponse response,
            @NonNull FilterChain filterChain) throws ServletException, IOException {

        final String authHeader = request.getHeader(HttpHeaders.AUTHORIZATION);

        if (authHeader == null || !authHeader.startsWith(BEARER_PREFIX)) {
            filterChain.doFilter(request, response);
            return;
        }

        final String jwt = authHeader.substring(BEARER_PREFIX.length()).trim();

        TokenClaims claims;
        try {
            claims = authorizationResolver.authenticate(jwt);
        } catch (TokenInvalidException e) {
            log.debug("Rejected bearer token on {}: {}", request.getRequestURI(), e.getMessage());
            SecurityContextHolder.clearContext();
            errorWriter.write(response, HttpStatus.UNAUTHORIZED, GlobalExceptionHandler.errorCode(e), e.getMessage());
            return;
        } catch (UpstreamUnavailableException e) {
            log.error("Token check unavailable on {}: {}", request.getRequestURI(), e.getMessage());
            errorWriter.write(response, HttpStatus.SERVICE_UNAVAILABLE, "UPSTREAM_UNAVAILABLE",
                    "Service temporarily unavailable");
            return;
        }

        UsernamePasswordAuthenticationToken authToken = new UsernamePasswordAuthenticationToken(
                claims,
                jwt,
                authorities(claims)
        );
        authToken.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
        SecurityContextHolder.getContext().setAuthentication(authToken);

        filterChain.doFilter(request, response);
    }

    private static List<SimpleGrantedAuthority> authorities(TokenClaims claims) {
        if (claims.role() == null) {
            return List.of();
        }
        return List.of(new SimpleGrantedAuthority("ROLE_" + claims.role().toUpperCase(Locale.ROOT)));
    }
}
