package com.nevis.reports.infra;

import com.nevis.reports.exception.RateLimitExceededException;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.Refill;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Requests-per-minute limiter with one greedy bucket per key. A caller waits at
 * most {@code maxWait} for its permits before the call is rejected.
 */
public class InMemoryRpmRateLimiter implements RateLimiter {

    private final ConcurrentHashMap<String, Bucket> buckets = new ConcurrentHashMap<>();

    private final int rpmLimit;
    private final Duration maxWait;

    public InMemoryRpmRateLimiter(int rpmLimit, Duration maxWait) {
        if (rpmLimit < 1) {
            throw new IllegalArgumentException("rpmLimit must be positive: " + rpmLimit);
        }
        this.rpmLimit = rpmLimit;
        this.maxWait = maxWait;
    }

    private Bucket createBucket() {
        return Bucket.builder()
            .addLimit(Bandwidth.classic(rpmLimit, Refill.greedy(rpmLimit, Duration.ofMinutes(1))))
            .build();
    }

    @Override
    public void acquire(String key, int permits) {
        Bucket bucket = buckets.computeIfAbsent(key, k -> createBucket());
        boolean granted;
        try {
            granted = maxWait.isZero() || maxWait.isNegative()
                ? bucket.tryConsume(permits)
                : bucket.asBlocking().tryConsume(permits, maxWait);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RateLimitExceededException(key);
        }
        if (!granted) {
            throw new RateLimitExceededException(key);
        }
    }
}
