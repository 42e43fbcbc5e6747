package com.shlokmestry.gateway.ratelimit;

import java.time.Instant;

import org.springframework.http.HttpHeaders;

import jakarta.servlet.http.HttpServletResponse;

public final class RateLimitHeaders {

    public static final String LIMIT = "X-RateLimit-Limit";
    public static final String REMAINING = "X-RateLimit-Remaining";
    public static final String RESET = "X-RateLimit-Reset";

    private RateLimitHeaders() {
    }

    public static void apply(HttpServletResponse response, RateLimitResult result, Instant now) {
        response.setHeader(LIMIT, String.valueOf(result.limit()));
        response.setHeader(REMAINING, String.valueOf(result.remaining()));
        response.setHeader(RESET, String.valueOf(result.resetAt().getEpochSecond()));
        if (!result.allowed()) {
            response.setHeader(HttpHeaders.RETRY_AFTER, String.valueOf(result.retryAfterSeconds(now)));
        }
    }

    public static HttpHeaders toHttpHeaders(RateLimitResult result, Instant now) {
        HttpHeaders h = new HttpHeaders();
        h.set(LIMIT, String.valueOf(result.limit()));
        h.set(REMAINING, String.valueOf(result.remaining()));
        h.set(RESET, String.valueOf(result.resetAt().getEpochSecond()));
        if (!result.allowed()) {
            h.set(HttpHeaders.RETRY_AFTER, String.valueOf(result.retryAfterSeconds(now)));
        }
        return h;
    }
}
