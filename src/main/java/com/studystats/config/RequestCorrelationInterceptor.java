package com.studystats.config;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

import java.util.UUID;

/**
 * Tags every API request with a request id.
 *
 * FLOW:
 *   preHandle        → X-Request-Id from the request, or a new UUID
 *                    → MDC "requestId", response header, start time attribute
 *   afterCompletion  → "Request completed" line with status and duration, MDC cleared
 */
@Slf4j
@Component
public class RequestCorrelationInterceptor implements HandlerInterceptor {

    public static final String REQUEST_ID_HEADER = "X-Request-Id";
    public static final String REQUEST_ID_MDC_KEY = "requestId";
    public static final String START_TIME_ATTRIBUTE = RequestCorrelationInterceptor.class.getName() + ".startTime";
    public static final String REQUEST_ID_ATTRIBUTE = RequestCorrelationInterceptor.class.getName() + ".requestId";

    @Override
    public boolean preHandle(@NonNull HttpServletRequest request,
                             @NonNull HttpServletResponse response,
                             @NonNull Object handler) {
        String requestId = request.getHeader(REQUEST_ID_HEADER);
        if (requestId == null || requestId.isBlank()) {
            requestId = UUID.randomUUID().toString();
        }

        MDC.put(REQUEST_ID_MDC_KEY, requestId);
        request.setAttribute(REQUEST_ID_ATTRIBUTE, requestId);
        request.setAttribute(START_TIME_ATTRIBUTE, System.currentTimeMillis());
        response.setHeader(REQUEST_ID_HEADER, requestId);
        return true;
    }

    @Override
    public void afterCompletion(@NonNull HttpServletRequest request,
                                @NonNull HttpServletResponse response,
                                @NonNull Object handler,
                                Exception ex) {
        long duration = elapsedMillis(request);
        int status = response.getStatus();
        if (status >= 500) {
            log.error("Request completed: {} {} - status={} durationMs={}",
                    request.getMethod(), request.getRequestURI(), status, duration);
        } else if (status >= 400) {
            log.warn("Request completed: {} {} - status={} durationMs={}",
                    request.getMethod(), request.getRequestURI(), status, duration);
        } else {
            log.info("Request completed: {} {} - status={} durationMs={}",
                    request.getMethod(), request.getRequestURI(), status, duration);
        }
        MDC.remove(REQUEST_ID_MDC_KEY);
    }

    /**
     * Milliseconds since preHandle ran for this request, or 0 when it never did.
     */
    public static long elapsedMillis(HttpServletRequest request) {
        Object start = request.getAttribute(START_TIME_ATTRIBUTE);
        return start instanceof Long ? System.currentTimeMillis() - (Long) start : 0;
    }

    public static String requestId(HttpServletRequest request) {
        Object id = request.getAttribute(REQUEST_ID_ATTRIBUTE);
        return id == null ? null : id.toString();
    }
}
