package com.studystats.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.studystats.config.StudyStatsProperties;
import com.studystats.dto.StudyProjectionRequest;
import com.studystats.exception.ApiException;
import com.studystats.exception.ErrorCategory;
import com.studystats.model.IdempotencyRecord;
import com.studystats.store.InMemoryKeyValueStore;
import com.studystats.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class IdempotencyServiceTest {

    private MutableClock clock;
    private InMemoryKeyValueStore<IdempotencyRecord> store;
    private IdempotencyService service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-03-05T10:00:00Z"));
        store = new InMemoryKeyValueStore<>(clock);
        service = new IdempotencyService(store, new ObjectMapper().findAndRegisterModules(),
                new StudyStatsProperties(), clock);
    }

    @Nested
    @DisplayName("Fingerprints")
    class Fingerprints {

        @Test
        @DisplayName("Key order does not change the fingerprint")
        void keyOrderIgnored() {
            Map<String, Object> first = new LinkedHashMap<>();
            first.put("a", 1);
            first.put("b", Map.of("y", 2, "x", 3));
            Map<String, Object> second = new LinkedHashMap<>();
            second.put("b", Map.of("x", 3, "y", 2));
            second.put("a", 1);

            assertEquals(service.fingerprint(first), service.fingerprint(second));
        }

        @Test
        @DisplayName("A DTO and the equivalent map share a fingerprint")
        void dtoMatchesMap() {
            StudyProjectionRequest request = new StudyProjectionRequest("2026-06-30", 4.5);
            Map<String, Object> map = Map.of("hoursPerDay", 4.5, "endDate", "2026-06-30");

            assertEquals(service.fingerprint(map), service.fingerprint(request));
        }

        @Test
        @DisplayName("Different values give different fingerprints")
        void differentValues() {
            assertNotEquals(service.fingerprint(Map.of("a", 1)), service.fingerprint(Map.of("a", 2)));
            assertEquals(64, service.fingerprint(Map.of("a", 1)).length());
        }
    }

    @Test
    @DisplayName("Without a key nothing is claimed, replayed or stored")
    void noKey_noIdempotency() {
        service.storeResult("op:user", null, "fp", 200, Map.of("ok", true));
        service.storeResult("op:user", "  ", "fp", 200, Map.of("ok", true));

        assertEquals(Optional.empty(), service.claim("op:user", null, "fp"));
        assertEquals(Optional.empty(), service.claim("op:user", "", "fp"));
        assertEquals(Optional.empty(), store.get("op:user:"));
        assertEquals(0, store.size());
    }

    @Test
    @DisplayName("First claim binds the key with a pending record")
    void firstClaim_storesPending() {
        assertEquals(Optional.empty(), service.claim("op:user", "key-1", "fp"));

        IdempotencyRecord pending = store.get("op:user:key-1").orElseThrow();
        assertTrue(pending.isPending());
        assertEquals("fp", pending.getFingerprint());
    }

    @Test
    @DisplayName("Same key and payload replays the stored response")
    void sameKeySamePayload_replays() {
        service.storeResult("op:user", "key-1", "fp", 200, Map.of("ok", true));

        Optional<IdempotencyRecord> replay = service.claim("op:user", "key-1", "fp");

        assertTrue(replay.isPresent());
        assertEquals(200, replay.get().getStatus());
        assertTrue(replay.get().getBody().get("ok").asBoolean());
    }

    @Test
    @DisplayName("Key is trimmed and scoped per user and operation")
    void keyScoping() {
        service.storeResult("op:alice", " key-1 ", "fp", 200, Map.of("ok", true));

        assertTrue(service.claim("op:alice", "key-1", "fp").isPresent());
        assertTrue(service.claim("op:bob", "key-1", "other").isEmpty());
    }

    @Nested
    @DisplayName("Conflicts")
    class Conflicts {

        @Test
        @DisplayName("Same key with a different payload is a conflict")
        void sameKeyDifferentPayload_conflicts() {
            service.storeResult("op:user", "key-1", "fp-a", 200, Map.of("ok", true));

            ApiException conflict = assertThrows(ApiException.class,
                    () -> service.claim("op:user", "key-1", "fp-b"));
            assertEquals(HttpStatus.CONFLICT, conflict.getStatus());
            assertEquals("IDEMPOTENCY_KEY_REUSED", conflict.getCode());
            assertEquals(ErrorCategory.CONFLICT, conflict.getCategory());
        }

        @Test
        @DisplayName("A pending claim rejects a different payload without rebinding the key")
        void pendingClaim_differentPayload() {
            service.claim("op:user", "key-1", "fp-a");

            ApiException conflict = assertThrows(ApiException.class,
                    () -> service.claim("op:user", "key-1", "fp-b"));

            assertEquals("IDEMPOTENCY_KEY_REUSED", conflict.getCode());
            assertEquals("fp-a", store.get("op:user:key-1").orElseThrow().getFingerprint());
        }

        @Test
        @DisplayName("A pending claim rejects the same payload as in progress")
        void pendingClaim_samePayload() {
            service.claim("op:user", "key-1", "fp-a");

            ApiException conflict = assertThrows(ApiException.class,
                    () -> service.claim("op:user", "key-1", "fp-a"));

            assertEquals(HttpStatus.CONFLICT, conflict.getStatus());
            assertEquals("IDEMPOTENCY_REQUEST_IN_PROGRESS", conflict.getCode());
        }
    }

    @Nested
    @DisplayName("Release")
    class Release {

        @Test
        @DisplayName("Releasing a pending claim frees the key")
        void releasePending() {
            service.claim("op:user", "key-1", "fp-a");

            service.release("op:user", "key-1", "fp-a");

            assertEquals(Optional.empty(), service.claim("op:user", "key-1", "fp-b"));
        }

        @Test
        @DisplayName("Completed records survive a release")
        void releaseKeepsCompleted() {
            service.storeResult("op:user", "key-1", "fp-a", 200, Map.of("ok", true));

            service.release("op:user", "key-1", "fp-a");

            assertTrue(service.claim("op:user", "key-1", "fp-a").isPresent());
        }
    }

    @Test
    @DisplayName("Records expire after their TTL")
    void expiry() {
        service.storeResult("op:user", "key-1", "fp-a", 200, Map.of("ok", true), Duration.ofMinutes(10));

        clock.advance(Duration.ofMinutes(10));

        assertTrue(service.claim("op:user", "key-1", "fp-b").isEmpty());
        assertEquals("fp-b", store.get("op:user:key-1").orElseThrow().getFingerprint());
    }
}
