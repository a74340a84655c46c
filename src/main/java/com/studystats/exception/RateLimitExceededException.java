package com.studystats.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public class RateLimitExceededException extends ApiException {

    private final long retryAfterSeconds;

    public RateLimitExceededException(long retryAfterSeconds) {
        super(HttpStatus.TOO_MANY_REQUESTS, "RATE_LIMITED", ErrorCategory.RATE_LIMIT,
                "Too many requests. Please retry later.");
        this.retryAfterSeconds = retryAfterSeconds;
    }
}
