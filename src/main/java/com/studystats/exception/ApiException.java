package com.studystats.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Typed failure carried up to the HTTP boundary.
 * GlobalExceptionHandler turns it into {error, code, category} with the given status.
 */
@Getter
public class ApiException extends RuntimeException {

    private final HttpStatus status;
    private final String code;
    private final ErrorCategory category;
    private final transient Object details;

    public ApiException(HttpStatus status, String code, ErrorCategory category, String message) {
        this(status, code, category, message, null);
    }

    public ApiException(HttpStatus status, String code, ErrorCategory category, String message, Object details) {
        super(message);
        this.status = status;
        this.code = code;
        this.category = category;
        this.details = details;
    }

    public static ApiException unauthorized(String code, String message) {
        return new ApiException(HttpStatus.UNAUTHORIZED, code, ErrorCategory.AUTH, message);
    }

    public static ApiException validation(String code, String message) {
        return new ApiException(HttpStatus.BAD_REQUEST, code, ErrorCategory.VALIDATION, message);
    }

    public static ApiException upstream(String code, String message) {
        return new ApiException(HttpStatus.BAD_GATEWAY, code, ErrorCategory.UPSTREAM, message);
    }

    public static ApiException internal(String code, String message) {
        return new ApiException(HttpStatus.INTERNAL_SERVER_ERROR, code, ErrorCategory.INTERNAL, message);
    }
}
