package com.studystats.controller;

import com.studystats.exception.ApiException;
import com.studystats.exception.ErrorCategory;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpStatus;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Header and query parameter parsing shared by the controllers.
 */
final class RequestHeaders {

    static final String IDEMPOTENCY_KEY = "Idempotency-Key";
    static final String IDEMPOTENT_REPLAY = "X-Idempotent-Replay";
    private static final String BEARER_PREFIX = "Bearer ";

    private RequestHeaders() {
    }

    /**
     * Token from "Authorization: Bearer {token}".
     * No header (or another scheme) fails with missingCode, a blank token with emptyCode.
     */
    static String requireBearer(String authorization, String missingCode, String emptyCode, String message) {
        if (authorization == null || !authorization.startsWith(BEARER_PREFIX)) {
            throw ApiException.unauthorized(missingCode, message);
        }
        String token = authorization.substring(BEARER_PREFIX.length()).trim();
        if (token.isEmpty()) {
            throw ApiException.unauthorized(emptyCode, message);
        }
        return token;
    }

    static String clientAddress(HttpServletRequest request) {
        String forwarded = request.getHeader("X-Forwarded-For");
        if (forwarded != null) {
            String candidate = forwarded.split(",")[0].trim();
            if (!candidate.isEmpty()) {
                return candidate;
            }
        }
        String realIp = request.getHeader("X-Real-IP");
        if (realIp != null && !realIp.isBlank()) {
            return realIp.trim();
        }
        return "unknown";
    }

    static List<String> splitIds(String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(id -> !id.isEmpty())
                .collect(Collectors.toList());
    }

    static int requireDays(Integer days, int defaultDays, int max) {
        if (days == null) {
            return defaultDays;
        }
        if (days < 1 || days > max) {
            throw new ApiException(HttpStatus.BAD_REQUEST, "QUERY_VALIDATION_ERROR", ErrorCategory.VALIDATION,
                    "Query validation failed.",
                    List.of(Map.of("path", "days", "message", "must be between 1 and " + max)));
        }
        return days;
    }

    static String optionalSubject(String subject) {
        if (subject == null) {
            return null;
        }
        String trimmed = subject.trim();
        if (trimmed.isEmpty()) {
            throw new ApiException(HttpStatus.BAD_REQUEST, "QUERY_VALIDATION_ERROR", ErrorCategory.VALIDATION,
                    "Query validation failed.",
                    List.of(Map.of("path", "subject", "message", "must not be blank")));
        }
        return trimmed;
    }
}
