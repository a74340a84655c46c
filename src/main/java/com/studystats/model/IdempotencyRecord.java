package com.studystats.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.*;

/**
 * Cached outcome of a mutating request, bound to the fingerprint of its body.
 * A pending record marks a claimed key whose write has not finished yet.
 * expiresAt is epoch millis.
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class IdempotencyRecord {

    private String fingerprint;
    private int status;
    private JsonNode body;
    private long expiresAt;
    private boolean pending;

    public static IdempotencyRecord pending(String fingerprint, long expiresAt) {
        return IdempotencyRecord.builder()
                .fingerprint(fingerprint)
                .expiresAt(expiresAt)
                .pending(true)
                .build();
    }

    public boolean isExpired(long nowMillis) {
        return expiresAt <= nowMillis;
    }
}
