package com.shlokmestry.gateway.api;

import java.util.List;

public record RateLimitStatsResponse(
        int totalKeys,
        long totalRequests,
        List<PolicyView> policies
) {

    public record PolicyView(String name, int maxRequests, long windowSeconds) {}
}
