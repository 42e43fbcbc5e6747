package com.shlokmestry.gateway.gateway;

import java.util.List;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Client identity for rate limiting and events: first {@code X-Forwarded-For} entry,
 * then {@code X-Real-IP}, then {@code CF-Connecting-IP}, then the socket address.
 */
public class ClientIdentityResolver {

    static final String UNKNOWN = "unknown";

    private static final List<String> SINGLE_VALUE_HEADERS = List.of("X-Real-IP", "CF-Connecting-IP");
    private static final int MAX_LENGTH = 64;

    public String resolve(HttpServletRequest request) {
        Object cached = request.getAttribute(GatewayAttributes.CLIENT_IDENTITY);
        if (cached instanceof String s) {
            return s;
        }

        String forwarded = request.getHeader("X-Forwarded-For");
        if (forwarded != null) {
            String first = forwarded.split(",")[0].trim();
            if (!first.isEmpty()) {
                return sanitize(first);
            }
        }

        for (String header : SINGLE_VALUE_HEADERS) {
            String value = request.getHeader(header);
            if (value != null && !value.isBlank()) {
                return sanitize(value.trim());
            }
        }

        String remote = request.getRemoteAddr();
        return remote == null || remote.isBlank() ? UNKNOWN : sanitize(remote);
    }

    // Header values end up in map keys and log lines.
    private static String sanitize(String value) {
        String cleaned = value.replaceAll("[^0-9A-Za-z.:\\[\\]%_-]", "");
        if (cleaned.isEmpty()) {
            return UNKNOWN;
        }
        return cleaned.length() > MAX_LENGTH ? cleaned.substring(0, MAX_LENGTH) : cleaned;
    }
}
