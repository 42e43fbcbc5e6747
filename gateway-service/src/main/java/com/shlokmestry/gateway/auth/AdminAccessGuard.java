package com.shlokmestry.gateway.auth;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;

import com.shlokmestry.gateway.events.RequestOrigin;
import com.shlokmestry.gateway.events.SecurityEventLogger;
import com.shlokmestry.gateway.events.SecurityEventType;
import com.shlokmestry.gateway.events.Severity;
import com.shlokmestry.gateway.gateway.ClientIdentityResolver;
import com.shlokmestry.gateway.gateway.GatewayAttributes;
import com.shlokmestry.gateway.gateway.GatewayError;
import com.shlokmestry.gateway.gateway.GatewayResponses;
import com.shlokmestry.gateway.observability.RateLimitMetrics;
import com.shlokmestry.gateway.ratelimit.RateLimitHeaders;
import com.shlokmestry.gateway.ratelimit.RateLimitKeys;
import com.shlokmestry.gateway.ratelimit.RateLimitPolicy;
import com.shlokmestry.gateway.ratelimit.RateLimitResult;
import com.shlokmestry.gateway.ratelimit.RateLimiter;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

/**
 * Wraps admin handlers: admin-API rate limit first, then bearer token verification, and
 * only then the handler. Rejections are written directly and recorded as security
 * events.
 */
public class AdminAccessGuard {

    static final String ADMIN_TOKEN_HEADER = "X-Admin-Token";
    static final String UNAUTHORIZED_MESSAGE = "Admin authentication required";

    private static final String BEARER = "Bearer ";

    private final AdminAuthService auth;
    private final RateLimiter limiter;
    private final RateLimitPolicy apiPolicy;
    private final RateLimitMetrics metrics;
    private final SecurityEventLogger events;
    private final ClientIdentityResolver identities;
    private final GatewayResponses responses;
    private final Clock clock;

    public AdminAccessGuard(
            AdminAuthService auth,
            RateLimiter limiter,
            RateLimitPolicy apiPolicy,
            RateLimitMetrics metrics,
            SecurityEventLogger events,
            ClientIdentityResolver identities,
            GatewayResponses responses,
            Clock clock
    ) {
        this.auth = auth;
        this.limiter = limiter;
        this.apiPolicy = apiPolicy;
        this.metrics = metrics;
        this.events = events;
        this.identities = identities;
        this.responses = responses;
        this.clock = clock;
    }

    public AdminHandler protect(AdminHandler handler) {
        return (request, response) -> {
            if (authorize(request, response)) {
                handler.handle(request, response);
            }
        };
    }

    /**
     * @return {@code true} if the request may proceed; otherwise the rejection has been
     *         written to {@code response}
     */
    boolean authorize(HttpServletRequest request, HttpServletResponse response) throws IOException {
        RequestOrigin origin = RequestOrigin.of(identities.resolve(request), request);
        String cid = GatewayResponses.correlationId(request);

        RateLimitResult rl = limiter.check(RateLimitKeys.of(RateLimitKeys.ADMIN_API, origin.clientIdentity()), apiPolicy);
        metrics.decision(apiPolicy, rl.allowed());
        RateLimitHeaders.apply(response, rl, Instant.now(clock));

        if (!rl.allowed()) {
            events.record(SecurityEventType.RATE_LIMIT_EXCEEDED, Severity.HIGH, origin, Map.of(
                    "endpoint", "admin_api",
                    "limit", apiPolicy.maxRequests()
            ));
            responses.writeJson(response, HttpStatus.TOO_MANY_REQUESTS.value(),
                    GatewayError.of(cid, "rate_limited", "Too many requests. Please try again later."));
            return false;
        }

        AuthResult<Instant> verified = auth.verify(extractToken(request));
        if (!verified.isSuccess()) {
            auth.authFailure(origin, verified.reason(), "admin_api");
            response.setHeader(HttpHeaders.WWW_AUTHENTICATE, "Bearer");
            responses.writeJson(response, HttpStatus.UNAUTHORIZED.value(),
                    GatewayError.of(cid, "unauthorized", UNAUTHORIZED_MESSAGE));
            return false;
        }

        request.setAttribute(GatewayAttributes.ADMIN_TOKEN_EXPIRES_AT, verified.value());
        return true;
    }

    static String extractToken(HttpServletRequest request) {
        String authorization = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authorization != null && authorization.regionMatches(true, 0, BEARER, 0, BEARER.length())) {
            String token = authorization.substring(BEARER.length()).trim();
            if (!token.isEmpty()) {
                return token;
            }
        }
        String header = request.getHeader(ADMIN_TOKEN_HEADER);
        return header == null ? null : header.trim();
    }
}
