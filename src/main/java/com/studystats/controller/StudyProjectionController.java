package com.studystats.controller;

import com.studystats.client.UserStoreClient;
import com.studystats.dto.MutationOutcome;
import com.studystats.dto.MutationRequest;
import com.studystats.dto.StudyProjectionRequest;
import com.studystats.dto.StudyProjectionResponse;
import com.studystats.service.RequestSafetyService;
import com.studystats.service.StudyProjectionService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * GET /api/study-projection
 * PUT /api/study-projection
 * {
 *   "endDate": "2026-06-30",
 *   "hoursPerDay": 4.5
 * }
 *
 * Authorization: Bearer {user-store token}. PUT honours Idempotency-Key.
 */
@RestController
@RequestMapping("/api/study-projection")
@RequiredArgsConstructor
public class StudyProjectionController {

    static final String OPERATION = "study-projection-put";

    private final UserStoreClient userStoreClient;
    private final StudyProjectionService projectionService;
    private final RequestSafetyService safetyService;

    @GetMapping
    public ResponseEntity<StudyProjectionResponse> get(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        String userId = resolveUser(authorization);
        return ResponseEntity.ok()
                .header(HttpHeaders.CACHE_CONTROL, "no-store")
                .body(projectionService.get(userId));
    }

    @PutMapping
    public ResponseEntity<Object> put(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestHeader(value = RequestHeaders.IDEMPOTENCY_KEY, required = false) String idempotencyKey,
            @Valid @RequestBody StudyProjectionRequest request,
            HttpServletRequest httpRequest) {
        String userId = resolveUser(authorization);

        MutationOutcome outcome = safetyService.execute(MutationRequest.builder()
                        .operation(OPERATION)
                        .identity(userId)
                        .clientAddress(RequestHeaders.clientAddress(httpRequest))
                        .idempotencyKey(idempotencyKey)
                        .body(request)
                        .build(),
                () -> MutationOutcome.fresh(HttpStatus.OK.value(), projectionService.save(userId, request)));

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
