package com.shlokmestry.gateway.auth;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.shlokmestry.gateway.crypto.CryptoProvider;
import com.shlokmestry.gateway.events.RequestOrigin;
import com.shlokmestry.gateway.events.SecurityEventLogger;
import com.shlokmestry.gateway.events.SecurityEventType;
import com.shlokmestry.gateway.events.Severity;
import com.shlokmestry.gateway.observability.RateLimitMetrics;
import com.shlokmestry.gateway.ratelimit.RateLimitKeys;
import com.shlokmestry.gateway.ratelimit.RateLimitPolicy;
import com.shlokmestry.gateway.ratelimit.RateLimitResult;
import com.shlokmestry.gateway.ratelimit.RateLimiter;

/**
 * Single-operator admin authentication.
 *
 * <p>{@link #login} is rate limited per client and, on success, issues a stateless
 * {@link AdminToken}. {@link #verify} re-runs the same credential comparison on the
 * password embedded in the token, so rotating the configured credential revokes every
 * token issued before. There is no server-side session or revocation list.
 */
public class AdminAuthService {

    private static final Logger log = LoggerFactory.getLogger(AdminAuthService.class);

    private final AdminCredentials credentials;
    private final CryptoProvider crypto;
    private final RateLimiter limiter;
    private final RateLimitPolicy loginPolicy;
    private final RateLimitMetrics metrics;
    private final SecurityEventLogger events;
    private final Clock clock;
    private final Duration tokenTtl;

    public AdminAuthService(
            AdminCredentials credentials,
            CryptoProvider crypto,
            RateLimiter limiter,
            RateLimitPolicy loginPolicy,
            RateLimitMetrics metrics,
            SecurityEventLogger events,
            Clock clock,
            Duration tokenTtl
    ) {
        this.credentials = credentials;
        this.crypto = crypto;
        this.limiter = limiter;
        this.loginPolicy = loginPolicy;
        this.metrics = metrics;
        this.events = events;
        this.clock = clock;
        this.tokenTtl = tokenTtl;
    }

    public AuthResult<AdminToken> login(String password, RequestOrigin origin) {
        RateLimitResult rl = limiter.check(RateLimitKeys.of(RateLimitKeys.ADMIN_LOGIN, origin.clientIdentity()), loginPolicy);
        metrics.decision(loginPolicy, rl.allowed());

        if (!rl.allowed()) {
            events.record(SecurityEventType.RATE_LIMIT_EXCEEDED, Severity.HIGH, origin, Map.of(
                    "endpoint", "admin_authentication",
                    "limit", loginPolicy.maxRequests(),
                    "windowSeconds", loginPolicy.window().toSeconds()
            ));
            return AuthResult.failed(AuthError.RATE_LIMITED, "rate_limited", rl);
        }

        Optional<String> failure = check(password);
        if (failure.isPresent()) {
            authFailure(origin, failure.get(), "admin_authentication");
            return AuthResult.failed(AuthError.UNAUTHORIZED, failure.get(), rl);
        }

        Instant expiresAt = Instant.now(clock).plus(tokenTtl);
        log.info("admin login ok client={} expiresAt={}", origin.clientIdentity(), expiresAt);
        return AuthResult.ok(new AdminToken(AdminTokenCodec.encode(password, expiresAt), expiresAt), rl);
    }

    /**
     * Verifies a bearer token. Does not rate limit or record events itself; the
     * {@link AdminAccessGuard} does both around it.
     */
    public AuthResult<Instant> verify(String token) {
        Optional<AdminTokenCodec.Decoded> decoded = AdminTokenCodec.decode(token);
        if (decoded.isEmpty()) {
            return AuthResult.failed(AuthError.UNAUTHORIZED, token == null || token.isBlank()
                    ? "missing_token"
                    : "invalid_token_format", null);
        }

        if (!Instant.now(clock).isBefore(decoded.get().expiresAt())) {
            return AuthResult.failed(AuthError.UNAUTHORIZED, "token_expired", null);
        }

        Optional<String> failure = check(decoded.get().password());
        if (failure.isPresent()) {
            return AuthResult.failed(AuthError.UNAUTHORIZED, failure.get(), null);
        }
        return AuthResult.ok(decoded.get().expiresAt(), null);
    }

    public void authFailure(RequestOrigin origin, String reason, String endpoint) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("endpoint", endpoint);
        details.put("reason", reason);
        events.record(SecurityEventType.AUTH_FAILURE, Severity.HIGH, origin, details);
    }

    public boolean isConfigured() {
        return credentials.isConfigured();
    }

    private Optional<String> check(String password) {
        if (password == null || password.isEmpty()) {
            return Optional.of("missing_password");
        }
        Optional<AdminCredential> active = credentials.active();
        if (active.isEmpty()) {
            return Optional.of("not_configured");
        }
        return active.get().matches(password, crypto)
                ? Optional.empty()
                : Optional.of("invalid_password");
    }
}
