package com.studystats.service;

import com.studystats.exception.RateLimitExceededException;
import com.studystats.model.RateBucket;
import com.studystats.store.KeyValueStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fixed-window rate limiter.
 *
 * HOW IT WORKS:
 *   1. Look up the bucket for the key
 *   2. Missing or expired → new bucket {count=1, resetAt=now+window}, allow
 *   3. count >= limit      → reject with retryAfterSeconds until resetAt
 *   4. otherwise           → count+1, allow
 *
 * Fixed windows accept bursts at window boundaries in exchange for O(1) state per key.
 * Keys look like "study-projection-put:{userId}:{address}" so users and
 * operations never share quota.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RateLimiter {

    private final KeyValueStore<RateBucket> rateBucketStore;
    private final Clock clock;

    public void checkAndConsume(String key, int limit, Duration window) {
        long now = clock.millis();
        AtomicLong rejectedResetAt = new AtomicLong(-1);

        rateBucketStore.compute(key, existing -> {
            rejectedResetAt.set(-1);
            if (existing == null || existing.isExpired(now)) {
                return new RateBucket(1, now + window.toMillis());
            }
            if (existing.getCount() >= limit) {
                rejectedResetAt.set(existing.getResetAt());
                return existing;
            }
            return new RateBucket(existing.getCount() + 1, existing.getResetAt());
        }, bucket -> Duration.ofMillis(bucket.getResetAt() - now));

        if (rejectedResetAt.get() >= 0) {
            long retryAfterSeconds = Math.max(1, (long) Math.ceil((rejectedResetAt.get() - now) / 1000d));
            log.warn("Rate limit exceeded: key={}, limit={}, retryAfter={}s", key, limit, retryAfterSeconds);
            throw new RateLimitExceededException(retryAfterSeconds);
        }
    }
}
