package com.shlokmestry.gateway.gateway;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.filter.OncePerRequestFilter;

import com.shlokmestry.gateway.config.DeploymentEnvironment;
import com.shlokmestry.gateway.crypto.CryptoProvider;
import com.shlokmestry.gateway.csp.CspPolicyBuilder;
import com.shlokmestry.gateway.events.RequestOrigin;
import com.shlokmestry.gateway.events.SecurityEventLogger;
import com.shlokmestry.gateway.events.SecurityEventType;
import com.shlokmestry.gateway.events.Severity;
import com.shlokmestry.gateway.headers.SecurityHeaderWriter;
import com.shlokmestry.gateway.hmac.HmacGate;
import com.shlokmestry.gateway.observability.RateLimitMetrics;
import com.shlokmestry.gateway.ratelimit.RateLimitHeaders;
import com.shlokmestry.gateway.ratelimit.RateLimitKeys;
import com.shlokmestry.gateway.ratelimit.RateLimitPolicies;
import com.shlokmestry.gateway.ratelimit.RateLimitPolicy;
import com.shlokmestry.gateway.ratelimit.RateLimitResult;
import com.shlokmestry.gateway.ratelimit.RateLimiter;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

/**
 * Runs in front of every request:
 *
 * <ol>
 *   <li>correlation id (inbound header echoed, else a fresh UUID)</li>
 *   <li>client identity</li>
 *   <li>CSP with a fresh nonce plus the hardening headers, so that rejections carry them
 *       too</li>
 *   <li>general rate limit, except for bypass paths</li>
 *   <li>for protected form posts: the form rate limit, then the body signature</li>
 * </ol>
 *
 * A rejection in step 4 or 5 is written here and the chain is not called.
 */
public class SecurityGatewayFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(SecurityGatewayFilter.class);

    private static final Pattern CORRELATION_ID = Pattern.compile("^[A-Za-z0-9._-]{1,64}$");

    private final DeploymentEnvironment environment;
    private final CryptoProvider crypto;
    private final CspPolicyBuilder csp;
    private final String cspReportUri;
    private final SecurityHeaderWriter headers;
    private final RateLimiter limiter;
    private final RateLimitPolicies policies;
    private final List<String> bypassPaths;
    private final RateLimitMetrics metrics;
    private final HmacGate hmac;
    private final int maxBodyBytes;
    private final SecurityEventLogger events;
    private final ClientIdentityResolver identities;
    private final GatewayResponses responses;
    private final Clock clock;

    public SecurityGatewayFilter(
            DeploymentEnvironment environment,
            CryptoProvider crypto,
            CspPolicyBuilder csp,
            String cspReportUri,
            SecurityHeaderWriter headers,
            RateLimiter limiter,
            RateLimitPolicies policies,
            List<String> bypassPaths,
            RateLimitMetrics metrics,
            HmacGate hmac,
            int maxBodyBytes,
            SecurityEventLogger events,
            ClientIdentityResolver identities,
            GatewayResponses responses,
            Clock clock
    ) {
        this.environment = environment;
        this.crypto = crypto;
        this.csp = csp;
        this.cspReportUri = cspReportUri;
        this.headers = headers;
        this.limiter = limiter;
        this.policies = policies;
        this.bypassPaths = List.copyOf(bypassPaths);
        this.metrics = metrics;
        this.hmac = hmac;
        this.maxBodyBytes = maxBodyBytes;
        this.events = events;
        this.identities = identities;
        this.responses = responses;
        this.clock = clock;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        String cid = correlationId(request);
        request.setAttribute(GatewayAttributes.CORRELATION_ID, cid);
        response.setHeader(GatewayAttributes.CORRELATION_HEADER, cid);

        String client = identities.resolve(request);
        request.setAttribute(GatewayAttributes.CLIENT_IDENTITY, client);
        RequestOrigin origin = RequestOrigin.of(client, request);

        writeSecurityHeaders(request, response);

        String path = pathOf(request);
        HttpServletRequest forwarded = request;
        try {
            if (!isBypassed(path)
                    && !admit(policies.general(), RateLimitKeys.GENERAL, origin, cid, response)) {
                return;
            }

            if (hmac.appliesTo(request.getMethod(), path)) {
                if (!admit(policies.form(), RateLimitKeys.FORM, origin, cid, response)) {
                    return;
                }
                CachedBodyRequest cached;
                try {
                    cached = CachedBodyRequest.wrap(request, maxBodyBytes);
                } catch (CachedBodyRequest.BodyTooLargeException e) {
                    events.record(SecurityEventType.SUSPICIOUS_REQUEST, Severity.MEDIUM, origin, Map.of(
                            "reason", "body_too_large",
                            "maxBytes", maxBodyBytes
                    ));
                    responses.writeJson(response, HttpStatus.PAYLOAD_TOO_LARGE.value(),
                            GatewayError.of(cid, "payload_too_large"));
                    return;
                }
                if (!hmac.verify(cached.body(), request.getHeader(hmac.signatureHeader()))) {
                    events.record(SecurityEventType.SIGNATURE_INVALID, Severity.HIGH, origin, Map.of(
                            "hasSignature", request.getHeader(hmac.signatureHeader()) != null,
                            "bodyBytes", cached.getContentLength()
                    ));
                    log.info("hmac reject cid={} client={} path={}", cid, client, path);
                    responses.writeJson(response, HttpStatus.UNAUTHORIZED.value(),
                            GatewayError.of(cid, "invalid_signature"));
                    return;
                }
                forwarded = cached;
            }
        } catch (RuntimeException e) {
            log.error("gateway error cid={} client={} path={}", cid, client, path, e);
            events.record(SecurityEventType.MIDDLEWARE_ERROR, Severity.CRITICAL, origin, Map.of(
                    "error", e.getClass().getSimpleName()
            ));
            responses.writeJson(response, HttpStatus.INTERNAL_SERVER_ERROR.value(),
                    GatewayError.of(cid, "internal_error"));
            return;
        }

        chain.doFilter(forwarded, response);
    }

    private boolean admit(RateLimitPolicy policy, String routeClass, RequestOrigin origin, String cid,
                          HttpServletResponse response) throws IOException {
        RateLimitResult rl = limiter.check(RateLimitKeys.of(routeClass, origin.clientIdentity()), policy);
        metrics.decision(policy, rl.allowed());
        RateLimitHeaders.apply(response, rl, Instant.now(clock));

        if (rl.allowed()) {
            return true;
        }

        events.record(SecurityEventType.RATE_LIMIT_EXCEEDED, Severity.HIGH, origin, Map.of(
                "policy", policy.name(),
                "limit", policy.maxRequests(),
                "windowSeconds", policy.window().toSeconds()
        ));
        log.info("ratelimit reject cid={} client={} policy={}", cid, origin.clientIdentity(), policy.name());
        responses.writeJson(response, HttpStatus.TOO_MANY_REQUESTS.value(), GatewayError.of(cid, "rate_limited"));
        return false;
    }

    private void writeSecurityHeaders(HttpServletRequest request, HttpServletResponse response) {
        String nonce = crypto.generateNonce();
        request.setAttribute(GatewayAttributes.CSP_NONCE, nonce);
        response.setHeader(GatewayAttributes.NONCE_HEADER, nonce);

        boolean dev = environment.isDevelopment();
        response.setHeader(csp.headerName(dev), csp.serialize(csp.build(nonce, dev), cspReportUri));
        headers.apply(response, environment.isProduction());
    }

    private boolean isBypassed(String path) {
        for (String prefix : bypassPaths) {
            if (path.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    private static String correlationId(HttpServletRequest request) {
        String inbound = request.getHeader(GatewayAttributes.CORRELATION_HEADER);
        if (inbound != null && CORRELATION_ID.matcher(inbound.trim()).matches()) {
            return inbound.trim();
        }
        return UUID.randomUUID().toString();
    }

    private static String pathOf(HttpServletRequest request) {
        return request.getRequestURI().substring(request.getContextPath().length());
    }
}
