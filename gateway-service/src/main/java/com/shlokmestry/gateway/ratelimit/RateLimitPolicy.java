package com.shlokmestry.gateway.ratelimit;

import java.time.Duration;

public record RateLimitPolicy(String name, int maxRequests, Duration window) {}
