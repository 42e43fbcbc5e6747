package com.shlokmestry.gateway.ratelimit;

import java.time.Duration;

import com.shlokmestry.gateway.config.GatewayProperties;

/**
 * The named policies callers apply. Values come from configuration; the limiter itself
 * knows nothing about them.
 */
public record RateLimitPolicies(
        RateLimitPolicy general,
        RateLimitPolicy form,
        RateLimitPolicy adminLogin,
        RateLimitPolicy adminApi
) {

    public static RateLimitPolicies from(GatewayProperties.RateLimit props) {
        return new RateLimitPolicies(
                new RateLimitPolicy("general", props.requestsPerMinute(), Duration.ofMinutes(1)),
                policy("form", props.form()),
                policy("admin_login", props.adminLogin()),
                policy("admin_api", props.adminApi())
        );
    }

    private static RateLimitPolicy policy(String name, GatewayProperties.Policy p) {
        return new RateLimitPolicy(name, p.maxRequests(), p.window());
    }
}
