package com.shlokmestry.gateway.ratelimit;

/**
 * Counter for one rate-limit key within its current fixed window. Immutable; the store
 * swaps whole instances.
 */
public record Bucket(int count, long windowStartMillis, long windowMillis) {

    public boolean isExpired(long nowMillis) {
        return nowMillis - windowStartMillis > windowMillis;
    }

    public long resetAtMillis() {
        return windowStartMillis + windowMillis;
    }
}
