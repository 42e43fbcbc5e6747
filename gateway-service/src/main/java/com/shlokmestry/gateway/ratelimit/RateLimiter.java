package com.shlokmestry.gateway.ratelimit;

import java.time.Duration;

/**
 * Per-key request counting. Never throws: an unknown key is simply a fresh bucket.
 */
public interface RateLimiter {

    /**
     * Counts one request against {@code key} and reports whether it fits within
     * {@code maxRequests} for the current window.
     */
    RateLimitResult check(String key, int maxRequests, Duration window);

    default RateLimitResult check(String key, RateLimitPolicy policy) {
        return check(key, policy.maxRequests(), policy.window());
    }

    /**
     * @return whether a bucket existed for {@code key}
     */
    boolean reset(String key);

    void resetAll();

    RateLimitStats stats();

    /**
     * Drops every bucket whose window has elapsed.
     *
     * @return number of buckets removed
     */
    int evictExpired();
}
