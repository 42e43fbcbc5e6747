package com.shlokmestry.gateway.ratelimit;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fixed-window counter: one bucket per key, reset once {@code now - windowStart} exceeds
 * the window. O(1) time and memory per key, at the price of allowing up to twice the
 * limit across a window boundary.
 *
 * <p>The store is bounded. When a new key arrives at a full store the expired buckets
 * are swept first; if that frees nothing, the oldest tenth is evicted.
 */
public class FixedWindowRateLimiter implements RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(FixedWindowRateLimiter.class);

    private final BucketStore store;
    private final Clock clock;
    private final int maxBuckets;

    public FixedWindowRateLimiter(BucketStore store, Clock clock, int maxBuckets) {
        if (maxBuckets < 1) {
            throw new IllegalArgumentException("maxBuckets must be positive");
        }
        this.store = store;
        this.clock = clock;
        this.maxBuckets = maxBuckets;
    }

    @Override
    public RateLimitResult check(String key, int maxRequests, Duration window) {
        long nowMs = clock.millis();
        long windowMs = Math.max(1, window.toMillis());

        if (store.size() >= maxBuckets && !store.contains(key)) {
            makeRoom(nowMs);
        }

        Bucket bucket = store.compute(key, (k, current) -> {
            if (current == null || nowMs - current.windowStartMillis() > windowMs) {
                return new Bucket(1, nowMs, windowMs);
            }
            int next = current.count() == Integer.MAX_VALUE ? current.count() : current.count() + 1;
            return new Bucket(next, current.windowStartMillis(), windowMs);
        });

        boolean allowed = bucket.count() <= maxRequests;
        int remaining = Math.max(0, maxRequests - bucket.count());

        if (!allowed) {
            log.debug("ratelimit deny key={} count={} max={} windowMs={}", key, bucket.count(), maxRequests, windowMs);
        }
        return new RateLimitResult(allowed, maxRequests, remaining, Instant.ofEpochMilli(bucket.resetAtMillis()));
    }

    @Override
    public boolean reset(String key) {
        return store.remove(key);
    }

    @Override
    public void resetAll() {
        RateLimitStats before = stats();
        store.clear();
        log.info("ratelimit reset_all keysBefore={} requestsBefore={}", before.totalKeys(), before.totalRequests());
    }

    @Override
    public RateLimitStats stats() {
        return new RateLimitStats(store.size(), store.totalCount());
    }

    @Override
    public int evictExpired() {
        long nowMs = clock.millis();
        return store.removeIf(b -> b.isExpired(nowMs));
    }

    private void makeRoom(long nowMs) {
        int expired = store.removeIf(b -> b.isExpired(nowMs));
        if (expired > 0) {
            log.debug("ratelimit store full, swept expired={}", expired);
            return;
        }
        int evicted = store.evictOldest(Math.max(1, maxBuckets / 10));
        log.warn("ratelimit store full with no expired buckets, evicted oldest={} maxBuckets={}", evicted, maxBuckets);
    }
}
