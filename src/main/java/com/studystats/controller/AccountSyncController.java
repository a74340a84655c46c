package com.studystats.controller;

import com.studystats.client.UserStoreClient;
import com.studystats.dto.AccountSyncRequest;
import com.studystats.dto.AccountSyncResponse;
import com.studystats.dto.MutationOutcome;
import com.studystats.dto.MutationRequest;
import com.studystats.service.AccountSyncService;
import com.studystats.service.RequestSafetyService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Per-user settings sync.
 *
 * GET /api/account-sync       → {"payload": {...}, "updatedAt": "..."}
 * PUT /api/account-sync       ← {"payload": {"theme": "dark"}}
 */
@RestController
@RequestMapping("/api/account-sync")
@RequiredArgsConstructor
public class AccountSyncController {

    static final String OPERATION = "account-sync-put";

    private final UserStoreClient userStoreClient;
    private final AccountSyncService syncService;
    private final RequestSafetyService safetyService;

    @GetMapping
    public ResponseEntity<AccountSyncResponse> get(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        String userId = resolveUser(authorization);
        return ResponseEntity.ok()
                .header(HttpHeaders.CACHE_CONTROL, "no-store")
                .body(syncService.get(userId));
    }

    @PutMapping
    public ResponseEntity<Object> put(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestHeader(value = RequestHeaders.IDEMPOTENCY_KEY, required = false) String idempotencyKey,
            @Valid @RequestBody AccountSyncRequest request,
            HttpServletRequest httpRequest) {
        String userId = resolveUser(authorization);

        MutationOutcome outcome = safetyService.execute(MutationRequest.builder()
                        .operation(OPERATION)
                        .identity(userId)
                        .clientAddress(RequestHeaders.clientAddress(httpRequest))
                        .idempotencyKey(idempotencyKey)
                        .body(request)
                        .build(),
                () -> MutationOutcome.fresh(HttpStatus.OK.value(), syncService.save(userId, request.getPayload())));

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
