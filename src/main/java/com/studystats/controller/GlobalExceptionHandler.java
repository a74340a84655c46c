package com.studystats.controller;

import com.studystats.config.RequestCorrelationInterceptor;
import com.studystats.dto.ApiErrorResponse;
import com.studystats.exception.ApiException;
import com.studystats.exception.ErrorCategory;
import com.studystats.exception.RateLimitExceededException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Every error leaves the API as
 *   {"error": "...", "code": "...", "category": "...", "retryAfterSeconds"?: n, "details"?: ...}
 *
 * ApiException carries its own status and code; framework binding failures map to
 * validation errors; anything else is a 500 INTERNAL_ERROR with a generic message.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ApiException.class)
    public ResponseEntity<ApiErrorResponse> handleApiException(ApiException e) {
        ApiErrorResponse body = ApiErrorResponse.builder()
                .error(e.getMessage())
                .code(e.getCode())
                .category(e.getCategory())
                .details(e.getDetails())
                .build();

        ResponseEntity.BodyBuilder response = ResponseEntity.status(e.getStatus());
        if (e instanceof RateLimitExceededException) {
            RateLimitExceededException rateLimited = (RateLimitExceededException) e;
            body.setRetryAfterSeconds(rateLimited.getRetryAfterSeconds());
            response.header(HttpHeaders.RETRY_AFTER, String.valueOf(rateLimited.getRetryAfterSeconds()));
        }
        if (e.getStatus().is5xxServerError()) {
            log.warn("Request failed: code={}, message={}", e.getCode(), e.getMessage());
        }
        return response.body(body);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiErrorResponse> handleValidation(MethodArgumentNotValidException e) {
        List<Map<String, String>> issues = e.getBindingResult().getFieldErrors().stream()
                .map(error -> Map.of(
                        "path", error.getField(),
                        "message", String.valueOf(error.getDefaultMessage())))
                .collect(Collectors.toList());
        return validationError("VALIDATION_ERROR", "Request validation failed.", issues);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
        return validationError("INVALID_JSON", "Invalid JSON body.", null);
    }

    @ExceptionHandler({MissingServletRequestParameterException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ApiErrorResponse> handleBadQuery(Exception e) {
        return validationError("QUERY_VALIDATION_ERROR", "Query validation failed.", null);
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ApiErrorResponse> handleMissingHeader(MissingRequestHeaderException e) {
        return validationError("VALIDATION_ERROR", "Missing header " + e.getHeaderName() + ".", null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiErrorResponse> handleUnexpected(Exception e, HttpServletRequest request) {
        log.error("Unhandled exception: {} {} requestId={} durationMs={}",
                request.getMethod(), request.getRequestURI(),
                RequestCorrelationInterceptor.requestId(request),
                RequestCorrelationInterceptor.elapsedMillis(request), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ApiErrorResponse.builder()
                .error("Internal server error.")
                .code("INTERNAL_ERROR")
                .category(ErrorCategory.INTERNAL)
                .build());
    }

    private static ResponseEntity<ApiErrorResponse> validationError(String code, String message, Object details) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiErrorResponse.builder()
                .error(message)
                .code(code)
                .category(ErrorCategory.VALIDATION)
                .details(details)
                .build());
    }
}
