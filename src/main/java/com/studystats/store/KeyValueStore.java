package com.studystats.store;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * Expiring key-value storage behind the rate limiter and the idempotency cache.
 *
 * Implementations:
 *   InMemoryKeyValueStore → single process, Caffeine cache
 *   RedisKeyValueStore    → shared across instances
 *
 * Expired entries are never returned.
 */
public interface KeyValueStore<V> {

    Optional<V> get(String key);

    void set(String key, V value, Duration ttl);

    void delete(String key);

    /**
     * Atomically replaces the value stored under {@code key}.
     * {@code remapping} receives null when the key is absent or expired and may be
     * invoked more than once under contention, so it must be side-effect free apart
     * from resettable captures. Returning null deletes the key.
     *
     * @param ttl expiry of the new value, computed from the value itself
     * @return the value now stored, or null if it was deleted
     */
    V compute(String key, UnaryOperator<V> remapping, Function<? super V, Duration> ttl);
}
