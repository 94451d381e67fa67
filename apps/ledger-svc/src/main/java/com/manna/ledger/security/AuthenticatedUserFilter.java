package com.manna.ledger.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.MDC;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Copies the authenticated user id into the request context and MDC so ledger mutations
 * can be correlated with the acting user in the logs.
 */
public class AuthenticatedUserFilter extends OncePerRequestFilter {

    private final AuthenticatedUserProvider authenticatedUserProvider;

    public AuthenticatedUserFilter(AuthenticatedUserProvider authenticatedUserProvider) {
        this.authenticatedUserProvider = authenticatedUserProvider;
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {
        authenticatedUserProvider.currentUserId()
                .ifPresent(userId -> MDC.put("user_id", userId.toString()));
        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove("user_id");
        }
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return request.getRequestURI().startsWith("/actuator/");
    }
}
