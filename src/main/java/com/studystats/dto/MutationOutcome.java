package com.studystats.dto;

import lombok.*;

/**
 * Status and body of a mutating call. replayed marks a response served from the idempotency cache.
 */
@Getter @AllArgsConstructor
public class MutationOutcome {
    private final int status;
    private final Object body;
    private final boolean replayed;

    public static MutationOutcome fresh(int status, Object body) {
        return new MutationOutcome(status, body, false);
    }

    public static MutationOutcome replay(int status, Object body) {
        return new MutationOutcome(status, body, true);
    }
}
