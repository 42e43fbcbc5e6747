package com.shlokmestry.gateway.ratelimit;

public record RateLimitStats(int totalKeys, long totalRequests) {}
