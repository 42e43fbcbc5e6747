package com.shlokmestry.gateway.observability;

import org.springframework.stereotype.Component;

import com.shlokmestry.gateway.ratelimit.RateLimitPolicy;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

@Component
public class RateLimitMetrics {

    private final MeterRegistry registry;

    public RateLimitMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void decision(RateLimitPolicy policy, boolean allowed) {
        Counter.builder("ratelimit.decisions.total")
                .description("Total rate-limit decisions (allowed/blocked)")
                .tag("allowed", String.valueOf(allowed))
                .tag("policy", policy.name())
                .register(registry)
                .increment();
    }

    public void reset(String action) {
        Counter.builder("ratelimit.resets.total")
                .description("Administrative rate-limit resets")
                .tag("action", action)
                .register(registry)
                .increment();
    }
}
