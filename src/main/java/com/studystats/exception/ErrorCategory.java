package com.studystats.exception;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Coarse error classes reported to API clients.
 * AUTH       → missing, invalid or expired credential
 * VALIDATION → malformed input
 * RATE_LIMIT → quota exceeded
 * UPSTREAM   → calendar or storage failure not caused by the caller
 * CONFLICT   → idempotency key reused with a different payload
 * INTERNAL   → anything unexpected
 */
public enum ErrorCategory {
    AUTH("auth"),
    VALIDATION("validation"),
    RATE_LIMIT("rate_limit"),
    UPSTREAM("upstream"),
    CONFLICT("conflict"),
    INTERNAL("internal");

    private final String tag;

    ErrorCategory(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String tag() {
        return tag;
    }
}
