package com.shlokmestry.gateway.headers;

import java.util.List;

import jakarta.servlet.http.HttpServletResponse;

/**
 * Static hardening headers attached to every response. HSTS only goes out in
 * production.
 */
public class SecurityHeaderWriter {

    static final String HSTS_VALUE = "max-age=31536000; includeSubDomains; preload";

    static final List<String> PERMISSIONS = List.of(
            "camera=()",
            "microphone=()",
            "geolocation=()",
            "interest-cohort=()",
            "payment=()",
            "usb=()",
            "bluetooth=()",
            "magnetometer=()",
            "gyroscope=()",
            "accelerometer=()",
            "autoplay=()",
            "fullscreen=(self)",
            "picture-in-picture=()",
            "web-share=()"
    );

    public void apply(HttpServletResponse response, boolean isProduction) {
        response.setHeader("X-Frame-Options", "DENY");
        response.setHeader("X-Content-Type-Options", "nosniff");
        response.setHeader("Referrer-Policy", "strict-origin-when-cross-origin");
        response.setHeader("Permissions-Policy", String.join(", ", PERMISSIONS));
        response.setHeader("X-XSS-Protection", "1; mode=block");
        response.setHeader("X-DNS-Prefetch-Control", "on");
        response.setHeader("Cross-Origin-Opener-Policy", "same-origin");
        response.setHeader("Cross-Origin-Resource-Policy", "same-origin");
        response.setHeader("X-Permitted-Cross-Domain-Policies", "none");
        response.setHeader("X-Download-Options", "noopen");

        if (isProduction) {
            response.setHeader("Strict-Transport-Security", HSTS_VALUE);
        }
    }
}
