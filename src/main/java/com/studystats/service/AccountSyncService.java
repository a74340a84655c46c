package com.studystats.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.studystats.dto.AccountSyncResponse;
import com.studystats.exception.ApiException;
import com.studystats.model.UserSyncRecord;
import com.studystats.repository.UserSyncRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Stores a per-user map of client settings (last write wins).
 *
 * Limits: at most 500 keys, keys 1-120 characters, values up to 200 000 characters.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountSyncService {

    static final int MAX_SYNC_KEYS = 500;
    static final int MAX_KEY_LENGTH = 120;
    static final int MAX_VALUE_LENGTH = 200_000;

    private final UserSyncRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public AccountSyncResponse get(String userId) {
        Optional<UserSyncRecord> stored;
        try {
            stored = repository.findById(userId);
        } catch (DataAccessException e) {
            if (StorageErrors.isTableMissing(e)) {
                log.warn("User sync table missing, serving disabled response");
                return AccountSyncResponse.builder().payload(Map.of()).cloudDisabled(true).build();
            }
            throw ApiException.upstream("STORAGE_READ_FAILED", "Failed to read synced data.");
        }

        if (stored.isEmpty()) {
            return AccountSyncResponse.builder().payload(Map.of()).build();
        }
        Map<String, String> payload = readPayload(stored.get().getPayload());
        return AccountSyncResponse.builder()
                .payload(payload)
                .updatedAt(stored.get().getUpdatedAt())
                .build();
    }

    public AccountSyncResponse save(String userId, Map<String, String> payload) {
        if (!isValidPayload(payload)) {
            throw ApiException.validation("INVALID_SYNC_PAYLOAD",
                    "Payload must be a map of string values.");
        }

        Instant updatedAt = clock.instant();
        try {
            repository.save(UserSyncRecord.builder()
                    .userId(userId)
                    .payload(objectMapper.writeValueAsString(payload))
                    .updatedAt(updatedAt)
                    .build());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize sync payload", e);
        } catch (DataAccessException e) {
            if (StorageErrors.isTableMissing(e)) {
                log.warn("User sync table missing, write not persisted: userId={}", userId);
                return AccountSyncResponse.builder().ok(false).updatedAt(updatedAt).cloudDisabled(true).build();
            }
            log.error("Failed to save synced data: userId={}, error={}", userId, e.getMessage());
            throw ApiException.upstream("STORAGE_WRITE_FAILED", "Failed to save synced data.");
        }

        log.info("Synced data saved: userId={}, keys={}", userId, payload.size());
        return AccountSyncResponse.builder().ok(true).updatedAt(updatedAt).build();
    }

    static boolean isValidPayload(Map<String, String> payload) {
        if (payload == null || payload.size() > MAX_SYNC_KEYS) {
            return false;
        }
        for (Map.Entry<String, String> entry : payload.entrySet()) {
            String key = entry.getKey();
            if (key == null || key.isEmpty() || key.length() > MAX_KEY_LENGTH) {
                return false;
            }
            if (entry.getValue() == null || entry.getValue().length() > MAX_VALUE_LENGTH) {
                return false;
            }
        }
        return true;
    }

    private Map<String, String> readPayload(String json) {
        try {
            Map<String, String> payload = objectMapper.readValue(json, new TypeReference<Map<String, String>>() {});
            if (isValidPayload(payload)) {
                return payload;
            }
        } catch (JsonProcessingException e) {
            log.error("Stored sync payload is not valid JSON: {}", e.getMessage());
        }
        throw ApiException.internal("STORED_SYNC_PAYLOAD_INVALID", "Stored sync payload is invalid.");
    }
}
