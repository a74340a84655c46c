package com.studystats.model;

import lombok.*;

/**
 * Fixed-window counter for one rate-limit key.
 * count never goes negative; resetAt is epoch millis.
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor
public class RateBucket {

    private int count;
    private long resetAt;

    public boolean isExpired(long nowMillis) {
        return resetAt <= nowMillis;
    }
}
