package com.shlokmestry.gateway.ratelimit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class BucketSweeper {

    private static final Logger log = LoggerFactory.getLogger(BucketSweeper.class);

    private final RateLimiter limiter;

    public BucketSweeper(RateLimiter limiter) {
        this.limiter = limiter;
    }

    @Scheduled(
            initialDelayString = "${gateway.rate-limit.sweep-interval:PT5M}",
            fixedDelayString = "${gateway.rate-limit.sweep-interval:PT5M}"
    )
    public void sweep() {
        int removed = limiter.evictExpired();
        if (removed > 0) {
            RateLimitStats stats = limiter.stats();
            log.info("ratelimit sweep removed={} remainingKeys={}", removed, stats.totalKeys());
        }
    }
}
