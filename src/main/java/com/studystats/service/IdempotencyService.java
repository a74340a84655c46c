package com.studystats.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.studystats.config.StudyStatsProperties;
import com.studystats.exception.ApiException;
import com.studystats.exception.ErrorCategory;
import com.studystats.model.IdempotencyRecord;
import com.studystats.store.KeyValueStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.util.HexFormat;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Replays responses of retried mutating requests.
 *
 * HOW IT WORKS:
 *   1. The client sends an Idempotency-Key header with a mutating request
 *   2. We fingerprint the body: SHA-256 of its canonical JSON (map keys sorted)
 *   3. claim() binds "{scope}:{key}" to the fingerprint in one atomic step,
 *      so two racing requests can never both run the write
 *   4. The winner writes, then storeResult() replaces the pending record with
 *      the response; on failure release() frees the key again
 *
 * No key means no idempotency: every call is treated as new.
 * Records expire after the configured TTL (default 10 minutes).
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class IdempotencyService {

    private final KeyValueStore<IdempotencyRecord> idempotencyStore;
    private final ObjectMapper objectMapper;
    private final StudyStatsProperties properties;
    private final Clock clock;

    public String fingerprint(Object body) {
        try {
            Object canonical = body == null ? null : objectMapper.convertValue(body, Object.class);
            byte[] json = objectMapper.writer()
                    .with(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                    .writeValueAsBytes(canonical);
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(json));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Request body cannot be fingerprinted", e);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Atomically binds the key to this fingerprint before the write runs.
     *
     *   nothing stored (or expired)  → store a pending record, caller may write
     *   other fingerprint            → 409 IDEMPOTENCY_KEY_REUSED
     *   same fingerprint, pending    → 409 IDEMPOTENCY_REQUEST_IN_PROGRESS
     *   same fingerprint, completed  → the cached record to replay
     *
     * @return the record to replay, or empty when the caller owns the key (or sent none)
     */
    public Optional<IdempotencyRecord> claim(String scope, String clientKey, String fingerprint) {
        if (clientKey == null || clientKey.isBlank()) {
            return Optional.empty();
        }

        long now = clock.millis();
        AtomicReference<IdempotencyRecord> existing = new AtomicReference<>();
        idempotencyStore.compute(storeKey(scope, clientKey), current -> {
            if (current == null || current.isExpired(now)) {
                existing.set(null);
                return IdempotencyRecord.pending(fingerprint, now + ttl().toMillis());
            }
            existing.set(current);
            return current;
        }, record -> remaining(record, now));

        IdempotencyRecord found = existing.get();
        if (found == null) {
            log.debug("Idempotency key claimed: scope={}", scope);
            return Optional.empty();
        }
        if (!found.getFingerprint().equals(fingerprint)) {
            log.warn("Idempotency key reused with a different payload: scope={}", scope);
            throw new ApiException(HttpStatus.CONFLICT, "IDEMPOTENCY_KEY_REUSED", ErrorCategory.CONFLICT,
                    "Idempotency key already used with a different payload.");
        }
        if (found.isPending()) {
            log.warn("Idempotent request still in progress: scope={}", scope);
            throw new ApiException(HttpStatus.CONFLICT, "IDEMPOTENCY_REQUEST_IN_PROGRESS", ErrorCategory.CONFLICT,
                    "A request with this idempotency key is still being processed.");
        }
        log.info("Replaying cached response: scope={}, status={}", scope, found.getStatus());
        return Optional.of(found);
    }

    /**
     * Drops a pending claim so the client can retry after a failed write.
     * A completed record, or one bound to another fingerprint, is left alone.
     */
    public void release(String scope, String clientKey, String fingerprint) {
        if (clientKey == null || clientKey.isBlank()) {
            return;
        }
        long now = clock.millis();
        idempotencyStore.compute(storeKey(scope, clientKey), current -> {
            if (current != null && current.isPending() && current.getFingerprint().equals(fingerprint)) {
                return null;
            }
            return current;
        }, record -> remaining(record, now));
    }

    public void storeResult(String scope, String clientKey, String fingerprint, int status, Object body) {
        storeResult(scope, clientKey, fingerprint, status, body, ttl());
    }

    public void storeResult(String scope, String clientKey, String fingerprint, int status, Object body,
                            Duration ttl) {
        if (clientKey == null || clientKey.isBlank()) {
            return;
        }
        IdempotencyRecord record = IdempotencyRecord.builder()
                .fingerprint(fingerprint)
                .status(status)
                .body(objectMapper.valueToTree(body))
                .expiresAt(clock.millis() + ttl.toMillis())
                .build();
        idempotencyStore.set(storeKey(scope, clientKey), record, ttl);
    }

    private Duration ttl() {
        return properties.getSafety().getIdempotencyTtl();
    }

    private static Duration remaining(IdempotencyRecord record, long now) {
        return Duration.ofMillis(Math.max(1, record.getExpiresAt() - now));
    }

    private String storeKey(String scope, String clientKey) {
        return scope + ":" + clientKey.trim();
    }
}
