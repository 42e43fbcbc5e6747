package com.shlokmestry.gateway.api;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.shlokmestry.gateway.gateway.ClientIdentityResolver;
import com.shlokmestry.gateway.observability.RateLimitMetrics;
import com.shlokmestry.gateway.ratelimit.RateLimitKeys;
import com.shlokmestry.gateway.ratelimit.RateLimitPolicies;
import com.shlokmestry.gateway.ratelimit.RateLimitPolicy;
import com.shlokmestry.gateway.ratelimit.RateLimitStats;
import com.shlokmestry.gateway.ratelimit.RateLimiter;

import jakarta.servlet.http.HttpServletRequest;

@RestController
@RequestMapping("/api/admin")
public class RateLimitAdminController {

    private static final Logger log = LoggerFactory.getLogger(RateLimitAdminController.class);

    private final RateLimiter limiter;
    private final RateLimitPolicies policies;
    private final RateLimitMetrics metrics;
    private final ClientIdentityResolver identities;

    public RateLimitAdminController(
            RateLimiter limiter,
            RateLimitPolicies policies,
            RateLimitMetrics metrics,
            ClientIdentityResolver identities
    ) {
        this.limiter = limiter;
        this.policies = policies;
        this.metrics = metrics;
        this.identities = identities;
    }

    /**
     * {@code contact} clears the caller's own form bucket; {@code ip} clears every bucket
     * of the given client; {@code all} clears the store.
     */
    @PostMapping("/reset-rate-limits")
    public ResetResponse reset(
            @RequestParam(defaultValue = "all") String action,
            @RequestParam(required = false) String ip,
            HttpServletRequest request
    ) {
        String normalized = action.trim().toLowerCase(Locale.ROOT);
        ResetResponse response = switch (normalized) {
            case "contact" -> {
                String key = RateLimitKeys.of(RateLimitKeys.FORM, identities.resolve(request));
                int cleared = limiter.reset(key) ? 1 : 0;
                yield new ResetResponse(true, normalized, cleared + " rate limit(s) reset successfully", cleared);
            }
            case "ip" -> {
                if (ip == null || ip.isBlank()) {
                    throw new InvalidRequestException("IP address required for IP-specific reset");
                }
                int cleared = 0;
                for (String routeClass : RateLimitKeys.CLASSES) {
                    if (limiter.reset(RateLimitKeys.of(routeClass, ip.trim()))) {
                        cleared++;
                    }
                }
                yield new ResetResponse(true, normalized, cleared + " rate limit(s) reset successfully", cleared);
            }
            case "all" -> {
                RateLimitStats before = limiter.stats();
                limiter.resetAll();
                yield new ResetResponse(true, normalized, "All rate limits reset successfully", before.totalKeys());
            }
            default -> throw new InvalidRequestException("Invalid action. Use \"contact\", \"ip\", or \"all\"");
        };

        metrics.reset(normalized);
        log.info("ratelimit admin_reset action={} ip={} keysCleared={} by={}",
                normalized, ip, response.keysCleared(), identities.resolve(request));
        return response;
    }

    @GetMapping("/reset-rate-limits")
    public Map<String, Object> describe() {
        Map<String, String> actions = new LinkedHashMap<>();
        actions.put("POST ?action=contact", "Reset contact form rate limits");
        actions.put("POST ?action=ip&ip=<ip>", "Reset rate limits for specific IP");
        actions.put("POST ?action=all", "Reset all rate limits");

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "Rate limit reset API");
        body.put("actions", actions);
        return body;
    }

    @GetMapping("/rate-limits/stats")
    public RateLimitStatsResponse stats() {
        RateLimitStats stats = limiter.stats();
        List<RateLimitStatsResponse.PolicyView> views = List.of(
                view(policies.general()),
                view(policies.form()),
                view(policies.adminLogin()),
                view(policies.adminApi())
        );
        return new RateLimitStatsResponse(stats.totalKeys(), stats.totalRequests(), views);
    }

    private static RateLimitStatsResponse.PolicyView view(RateLimitPolicy p) {
        return new RateLimitStatsResponse.PolicyView(p.name(), p.maxRequests(), p.window().toSeconds());
    }
}
