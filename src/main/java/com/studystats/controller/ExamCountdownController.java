package com.studystats.controller;

import com.studystats.client.UserStoreClient;
import com.studystats.dto.ExamCountdownRequest;
import com.studystats.dto.ExamCountdownResponse;
import com.studystats.dto.MutationOutcome;
import com.studystats.dto.MutationRequest;
import com.studystats.service.ExamCountdownService;
import com.studystats.service.RequestSafetyService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * GET /api/exam-countdown
 * PUT /api/exam-countdown
 * {
 *   "examDate": "2026-05-14",
 *   "countdownStartDate": "2026-01-05"
 * }
 *
 * Authorization: Bearer {user-store token}. PUT honours Idempotency-Key.
 */
@RestController
@RequestMapping("/api/exam-countdown")
@RequiredArgsConstructor
public class ExamCountdownController {

    static final String OPERATION = "exam-countdown-put";

    private final UserStoreClient userStoreClient;
    private final ExamCountdownService countdownService;
    private final RequestSafetyService safetyService;

    @GetMapping
    public ResponseEntity<ExamCountdownResponse> get(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        String userId = resolveUser(authorization);
        return ResponseEntity.ok()
                .header(HttpHeaders.CACHE_CONTROL, "no-store")
                .body(countdownService.get(userId));
    }

    @PutMapping
    public ResponseEntity<Object> put(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestHeader(value = RequestHeaders.IDEMPOTENCY_KEY, required = false) String idempotencyKey,
            @Valid @RequestBody ExamCountdownRequest request,
            HttpServletRequest httpRequest) {
        String userId = resolveUser(authorization);

        MutationOutcome outcome = safetyService.execute(MutationRequest.builder()
                        .operation(OPERATION)
                        .identity(userId)
                        .clientAddress(RequestHeaders.clientAddress(httpRequest))
                        .idempotencyKey(idempotencyKey)
                        .body(request)
                        .build(),
                () -> MutationOutcome.fresh(HttpStatus.OK.value(), countdownService.save(userId, request)));

        ResponseEntity.BodyBuilder response = ResponseEntity.status(outcome.getStatus())
                .header(HttpHeaders.CACHE_CONTROL, "no-store");
        if (outcome.isReplayed()) {
            response.header(RequestHeaders.IDEMPOTENT_REPLAY, "true");
        }
        return response.body(outcome.getBody());
    }

    private String resolveUser(String authorization) {
        String token = RequestHeaders.requireBearer(authorization,
                "MISSING_BEARER_TOKEN", "EMPTY_BEARER_TOKEN", "Missing authentication token.");
        return userStoreClient.resolveUserId(token);
    }
}
