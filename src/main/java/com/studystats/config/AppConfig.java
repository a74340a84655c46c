package com.studystats.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.studystats.model.IdempotencyRecord;
import com.studystats.model.RateBucket;
import com.studystats.store.InMemoryKeyValueStore;
import com.studystats.store.KeyValueStore;
import com.studystats.store.RedisKeyValueStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;

/**
 * Infrastructure beans.
 *
 * Safety stores follow studystats.safety.store:
 *   memory → one process-local Caffeine cache per store (default)
 *   redis  → shared across instances, keys "{prefix}ratelimit:" and "{prefix}idempotency:"
 */
@Configuration
@Slf4j
public class AppConfig {

    static final String REDIS_STORE = "redis";

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder, StudyStatsProperties properties) {
        return builder
                .setConnectTimeout(properties.getCalendar().getConnectTimeout())
                .setReadTimeout(properties.getCalendar().getReadTimeout())
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public KeyValueStore<RateBucket> rateBucketStore(StudyStatsProperties properties,
                                                     ObjectProvider<StringRedisTemplate> redisTemplate,
                                                     ObjectMapper objectMapper, Clock clock) {
        return createStore(properties, redisTemplate, objectMapper, clock, RateBucket.class, "ratelimit:");
    }

    @Bean
    public KeyValueStore<IdempotencyRecord> idempotencyStore(StudyStatsProperties properties,
                                                             ObjectProvider<StringRedisTemplate> redisTemplate,
                                                             ObjectMapper objectMapper, Clock clock) {
        return createStore(properties, redisTemplate, objectMapper, clock, IdempotencyRecord.class, "idempotency:");
    }

    private <V> KeyValueStore<V> createStore(StudyStatsProperties properties,
                                             ObjectProvider<StringRedisTemplate> redisTemplate,
                                             ObjectMapper objectMapper, Clock clock,
                                             Class<V> type, String namespace) {
        StudyStatsProperties.Safety safety = properties.getSafety();
        if (REDIS_STORE.equalsIgnoreCase(safety.getStore())) {
            StringRedisTemplate template = redisTemplate.getIfAvailable();
            if (template == null) {
                throw new IllegalStateException("studystats.safety.store=redis but no Redis connection is configured");
            }
            log.info("Using Redis store for {} (prefix {})", type.getSimpleName(), safety.getRedisKeyPrefix() + namespace);
            return new RedisKeyValueStore<>(template, objectMapper, type, safety.getRedisKeyPrefix() + namespace);
        }
        log.info("Using in-memory store for {}", type.getSimpleName());
        return new InMemoryKeyValueStore<>(clock);
    }
}
