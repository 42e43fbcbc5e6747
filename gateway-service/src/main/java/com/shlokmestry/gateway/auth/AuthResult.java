package com.shlokmestry.gateway.auth;

import com.shlokmestry.gateway.ratelimit.RateLimitResult;

/**
 * Outcome of a login or token verification.
 *
 * @param value     the token (login) or its expiry (verify); {@code null} on failure
 * @param error     {@code null} on success
 * @param reason    internal failure detail for logs and events, never sent to clients
 * @param rateLimit the rate-limit decision taken on the way, if any
 */
public record AuthResult<T>(T value, AuthError error, String reason, RateLimitResult rateLimit) {

    public static <T> AuthResult<T> ok(T value, RateLimitResult rateLimit) {
        return new AuthResult<>(value, null, null, rateLimit);
    }

    public static <T> AuthResult<T> failed(AuthError error, String reason, RateLimitResult rateLimit) {
        return new AuthResult<>(null, error, reason, rateLimit);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
