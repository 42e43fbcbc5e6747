package com.shlokmestry.gateway.ratelimit;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.shlokmestry.gateway.support.MutableClock;

class FixedWindowRateLimiterTest {

    private static final Duration FIFTEEN_MINUTES = Duration.ofMinutes(15);

    private MutableClock clock;
    private InMemoryBucketStore store;
    private FixedWindowRateLimiter limiter;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-03-01T10:00:00Z");
        store = new InMemoryBucketStore();
        limiter = new FixedWindowRateLimiter(store, clock, 1000);
    }

    @Test
    void fiveAllowedThenSixthDenied() {
        String key = "login:127.0.0.1";
        List<Integer> remaining = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            RateLimitResult r = limiter.check(key, 5, FIFTEEN_MINUTES);
            assertThat(r.allowed()).isTrue();
            remaining.add(r.remaining());
        }
        assertThat(remaining).containsExactly(4, 3, 2, 1, 0);

        RateLimitResult sixth = limiter.check(key, 5, FIFTEEN_MINUTES);
        assertThat(sixth.allowed()).isFalse();
        assertThat(sixth.remaining()).isZero();
        assertThat(sixth.limit()).isEqualTo(5);
    }

    @Test
    void allowedAgainOnceWindowElapses() {
        String key = "ip:10.0.0.1";
        for (int i = 0; i < 3; i++) {
            limiter.check(key, 3, Duration.ofMinutes(1));
        }
        assertThat(limiter.check(key, 3, Duration.ofMinutes(1)).allowed()).isFalse();

        // still inside the window at exactly the boundary
        clock.advance(Duration.ofMinutes(1));
        assertThat(limiter.check(key, 3, Duration.ofMinutes(1)).allowed()).isFalse();

        clock.advance(Duration.ofMillis(1));
        RateLimitResult fresh = limiter.check(key, 3, Duration.ofMinutes(1));
        assertThat(fresh.allowed()).isTrue();
        assertThat(fresh.remaining()).isEqualTo(2);
    }

    @Test
    void resetAtIsWindowStartPlusWindow() {
        RateLimitResult r = limiter.check("ip:a", 10, Duration.ofMinutes(1));
        assertThat(r.resetAt()).isEqualTo(Instant.parse("2024-03-01T10:01:00Z"));

        clock.advance(Duration.ofSeconds(20));
        RateLimitResult later = limiter.check("ip:a", 10, Duration.ofMinutes(1));
        assertThat(later.resetAt()).isEqualTo(r.resetAt());
        assertThat(later.retryAfterSeconds(clock.instant())).isEqualTo(40);
    }

    @Test
    void exhaustingOneKeyLeavesOthersUntouched() {
        for (int i = 0; i < 6; i++) {
            limiter.check("ip:1.1.1.1", 5, FIFTEEN_MINUTES);
        }
        assertThat(limiter.check("ip:1.1.1.1", 5, FIFTEEN_MINUTES).allowed()).isFalse();

        RateLimitResult other = limiter.check("ip:2.2.2.2", 5, FIFTEEN_MINUTES);
        assertThat(other.allowed()).isTrue();
        assertThat(other.remaining()).isEqualTo(4);
    }

    @Test
    void resetClearsOnlyThatKey() {
        limiter.check("contact:a", 1, FIFTEEN_MINUTES);
        limiter.check("contact:b", 1, FIFTEEN_MINUTES);

        assertThat(limiter.reset("contact:a")).isTrue();
        assertThat(limiter.reset("contact:missing")).isFalse();

        assertThat(limiter.check("contact:a", 1, FIFTEEN_MINUTES).allowed()).isTrue();
        assertThat(limiter.check("contact:b", 1, FIFTEEN_MINUTES).allowed()).isFalse();
    }

    @Test
    void resetAllAndStats() {
        limiter.check("ip:a", 10, FIFTEEN_MINUTES);
        limiter.check("ip:a", 10, FIFTEEN_MINUTES);
        limiter.check("ip:b", 10, FIFTEEN_MINUTES);

        RateLimitStats stats = limiter.stats();
        assertThat(stats.totalKeys()).isEqualTo(2);
        assertThat(stats.totalRequests()).isEqualTo(3);

        limiter.resetAll();
        assertThat(limiter.stats().totalKeys()).isZero();
    }

    @Test
    void evictExpiredDropsOnlyStaleBuckets() {
        limiter.check("ip:old", 10, Duration.ofMinutes(1));
        clock.advance(Duration.ofMinutes(2));
        limiter.check("ip:new", 10, Duration.ofMinutes(1));

        assertThat(limiter.evictExpired()).isEqualTo(1);
        assertThat(store.contains("ip:old")).isFalse();
        assertThat(store.contains("ip:new")).isTrue();
    }

    @Test
    void fullStoreSweepsExpiredBeforeAdmittingNewKey() {
        FixedWindowRateLimiter bounded = new FixedWindowRateLimiter(store, clock, 2);
        bounded.check("ip:a", 10, Duration.ofMinutes(1));
        bounded.check("ip:b", 10, Duration.ofMinutes(1));
        clock.advance(Duration.ofMinutes(5));

        bounded.check("ip:c", 10, Duration.ofMinutes(1));

        assertThat(store.size()).isEqualTo(1);
        assertThat(store.contains("ip:c")).isTrue();
    }

    @Test
    void fullStoreWithNothingExpiredEvictsOldest() {
        FixedWindowRateLimiter bounded = new FixedWindowRateLimiter(store, clock, 2);
        bounded.check("ip:a", 10, FIFTEEN_MINUTES);
        clock.advance(Duration.ofSeconds(1));
        bounded.check("ip:b", 10, FIFTEEN_MINUTES);
        clock.advance(Duration.ofSeconds(1));

        bounded.check("ip:c", 10, FIFTEEN_MINUTES);

        assertThat(store.contains("ip:a")).isFalse();
        assertThat(store.contains("ip:b")).isTrue();
        assertThat(store.contains("ip:c")).isTrue();
    }

    @Test
    void concurrentChecksAdmitExactlyTheLimit() throws Exception {
        int threads = 16;
        int perThread = 50;
        int limit = 100;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Integer>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    int allowed = 0;
                    for (int i = 0; i < perThread; i++) {
                        if (limiter.check("ip:shared", limit, FIFTEEN_MINUTES).allowed()) {
                            allowed++;
                        }
                    }
                    return allowed;
                }));
            }
            start.countDown();

            int total = 0;
            for (Future<Integer> f : futures) {
                total += f.get(10, TimeUnit.SECONDS);
            }
            assertThat(total).isEqualTo(limit);
            assertThat(limiter.stats().totalRequests()).isEqualTo((long) threads * perThread);
        } finally {
            pool.shutdownNow();
        }
    }
}
