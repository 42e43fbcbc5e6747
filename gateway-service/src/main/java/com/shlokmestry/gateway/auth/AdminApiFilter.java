package com.shlokmestry.gateway.auth;

import java.io.IOException;

import org.springframework.web.filter.OncePerRequestFilter;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

/**
 * Puts every {@code /api/admin/**} route except login behind {@link AdminAccessGuard}.
 */
public class AdminApiFilter extends OncePerRequestFilter {

    public static final String ADMIN_PREFIX = "/api/admin/";
    public static final String LOGIN_PATH = "/api/admin/auth/login";

    private final AdminAccessGuard guard;

    public AdminApiFilter(AdminAccessGuard guard) {
        this.guard = guard;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI().substring(request.getContextPath().length());
        return !path.startsWith(ADMIN_PREFIX) || path.equals(LOGIN_PATH);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        guard.protect(chain::doFilter).handle(request, response);
    }
}
