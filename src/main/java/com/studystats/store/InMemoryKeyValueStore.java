package com.studystats.store;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * Process-local store on a Caffeine cache.
 *
 * HOW IT WORKS:
 *   - every entry carries its own TTL (variable expiry), read from the injected Clock
 *   - expired entries are evicted by Caffeine's maintenance, not only on access,
 *     so keys that are never requested again do not accumulate
 *   - compute() goes through cache.asMap().compute for per-key atomicity
 *
 * Good for a single-instance deployment; use RedisKeyValueStore to share state.
 */
@Slf4j
public class InMemoryKeyValueStore<V> implements KeyValueStore<V> {

    private final Cache<String, Entry<V>> cache;
    private final Clock clock;

    public InMemoryKeyValueStore(Clock clock) {
        this.clock = clock;
        this.cache = Caffeine.newBuilder()
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .executor(Runnable::run)
                .expireAfter(new EntryExpiry<V>())
                .build();
    }

    @Override
    public Optional<V> get(String key) {
        Entry<V> entry = cache.getIfPresent(key);
        if (entry == null || entry.isExpired(clock.millis())) {
            return Optional.empty();
        }
        return Optional.of(entry.value);
    }

    @Override
    public void set(String key, V value, Duration ttl) {
        cache.put(key, new Entry<>(value, clock.millis(), ttl));
    }

    @Override
    public void delete(String key) {
        cache.invalidate(key);
    }

    @Override
    public V compute(String key, UnaryOperator<V> remapping, Function<? super V, Duration> ttl) {
        Entry<V> updated = cache.asMap().compute(key, (k, existing) -> {
            long now = clock.millis();
            V current = existing == null || existing.isExpired(now) ? null : existing.value;
            V next = remapping.apply(current);
            return next == null ? null : new Entry<>(next, now, ttl.apply(next));
        });
        return updated == null ? null : updated.value;
    }

    /**
     * Number of live entries after running pending evictions.
     */
    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    private static final class Entry<V> {
        private final V value;
        private final long expiresAt;
        private final long ttlNanos;

        private Entry(V value, long now, Duration ttl) {
            long ttlMillis = Math.max(0, ttl.toMillis());
            this.value = value;
            this.expiresAt = now + ttlMillis;
            this.ttlNanos = TimeUnit.MILLISECONDS.toNanos(ttlMillis);
        }

        private boolean isExpired(long now) {
            return expiresAt <= now;
        }
    }

    private static final class EntryExpiry<V> implements Expiry<String, Entry<V>> {

        @Override
        public long expireAfterCreate(String key, Entry<V> entry, long currentTime) {
            return entry.ttlNanos;
        }

        @Override
        public long expireAfterUpdate(String key, Entry<V> entry, long currentTime, long currentDuration) {
            return entry.ttlNanos;
        }

        @Override
        public long expireAfterRead(String key, Entry<V> entry, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
