package com.shlokmestry.gateway.ratelimit;

import java.time.Instant;

public record RateLimitResult(
        boolean allowed,
        int limit,
        int remaining,
        Instant resetAt
) {

    /**
     * Whole seconds until the window resets, never less than one.
     */
    public long retryAfterSeconds(Instant now) {
        long millis = resetAt.toEpochMilli() - now.toEpochMilli();
        return Math.max(1, (long) Math.ceil(millis / 1000.0));
    }
}
