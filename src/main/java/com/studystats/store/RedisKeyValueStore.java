package com.studystats.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * Redis-backed store so rate limits and idempotency records are shared by all instances.
 *
 * HOW IT WORKS:
 *   - values are JSON strings under "{prefix}{key}"
 *   - expiry is the native Redis TTL (SET ... PX)
 *   - compute() is optimistic: WATCH key → read → MULTI → SET/DEL → EXEC,
 *     retried when another writer touched the key in between
 */
@Slf4j
public class RedisKeyValueStore<V> implements KeyValueStore<V> {

    private static final int MAX_ATTEMPTS = 10;
    private static final Duration MIN_TTL = Duration.ofMillis(1);

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final Class<V> type;
    private final String prefix;

    public RedisKeyValueStore(StringRedisTemplate redisTemplate, ObjectMapper objectMapper,
                              Class<V> type, String prefix) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.type = type;
        this.prefix = prefix;
    }

    @Override
    public Optional<V> get(String key) {
        return Optional.ofNullable(read(redisTemplate.opsForValue().get(prefix + key)));
    }

    @Override
    public void set(String key, V value, Duration ttl) {
        redisTemplate.opsForValue().set(prefix + key, write(value), atLeastMinimum(ttl));
    }

    @Override
    public void delete(String key) {
        redisTemplate.delete(prefix + key);
    }

    @Override
    public V compute(String key, UnaryOperator<V> remapping, Function<? super V, Duration> ttl) {
        String redisKey = prefix + key;
        AtomicReference<V> stored = new AtomicReference<>();

        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            Boolean committed = redisTemplate.execute(new SessionCallback<Boolean>() {
                @Override
                @SuppressWarnings("unchecked")
                public <K, HV> Boolean execute(RedisOperations<K, HV> operations) throws DataAccessException {
                    RedisOperations<String, String> ops = (RedisOperations<String, String>) operations;
                    ops.watch(redisKey);
                    V next = remapping.apply(read(ops.opsForValue().get(redisKey)));
                    ops.multi();
                    if (next == null) {
                        ops.delete(redisKey);
                    } else {
                        ops.opsForValue().set(redisKey, write(next), atLeastMinimum(ttl.apply(next)));
                    }
                    List<Object> results = ops.exec();
                    stored.set(next);
                    return results != null && !results.isEmpty();
                }
            });
            if (Boolean.TRUE.equals(committed)) {
                return stored.get();
            }
            log.debug("Concurrent update on {}, retrying (attempt {})", redisKey, attempt);
        }
        throw new IllegalStateException("Could not update " + redisKey + " after " + MAX_ATTEMPTS + " attempts");
    }

    private V read(String json) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt " + type.getSimpleName() + " in Redis", e);
        }
    }

    private String write(V value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize " + type.getSimpleName(), e);
        }
    }

    private static Duration atLeastMinimum(Duration ttl) {
        return ttl.compareTo(MIN_TTL) < 0 ? MIN_TTL : ttl;
    }
}
