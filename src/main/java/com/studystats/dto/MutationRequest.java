package com.studystats.dto;

import lombok.*;

/**
 * Everything the request safety layer needs to know about a mutating call.
 *
 *   operation      = "study-projection-put"   (selects the rate limit policy)
 *   identity       = user id from the user store
 *   clientAddress  = first X-Forwarded-For entry, X-Real-IP, or "unknown"
 *   idempotencyKey = optional Idempotency-Key header
 *   body           = parsed request body, fingerprinted for replay detection
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class MutationRequest {
    private String operation;
    private String identity;
    private String clientAddress;
    private String idempotencyKey;
    private Object body;

    public String rateLimitKey() {
        return operation + ":" + identity + ":" + clientAddress;
    }

    public String idempotencyScope() {
        return operation + ":" + identity;
    }
}
