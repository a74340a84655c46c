package com.studystats.service;

import com.studystats.config.StudyStatsProperties;
import com.studystats.dto.MutationOutcome;
import com.studystats.dto.MutationRequest;
import com.studystats.model.IdempotencyRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Wraps every mutating endpoint.
 *
 * ORDER (a rejected or replayed request must never write twice):
 *   1. rate limit    "{operation}:{identity}:{address}"
 *   2. claim         "{operation}:{identity}:{idempotencyKey}" (replay or 409 when taken)
 *   3. run the write (a failure releases the claim)
 *   4. remember the outcome under the idempotency key
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RequestSafetyService {

    private final RateLimiter rateLimiter;
    private final IdempotencyService idempotencyService;
    private final StudyStatsProperties properties;

    public MutationOutcome execute(MutationRequest request, Supplier<MutationOutcome> write) {
        StudyStatsProperties.RateLimit policy = properties.getSafety().rateLimitFor(request.getOperation());
        rateLimiter.checkAndConsume(request.rateLimitKey(), policy.getLimit(), policy.getWindow());

        String fingerprint = idempotencyService.fingerprint(request.getBody());
        Optional<IdempotencyRecord> replay = idempotencyService.claim(
                request.idempotencyScope(), request.getIdempotencyKey(), fingerprint);
        if (replay.isPresent()) {
            return MutationOutcome.replay(replay.get().getStatus(), replay.get().getBody());
        }

        MutationOutcome outcome;
        try {
            outcome = write.get();
        } catch (RuntimeException e) {
            idempotencyService.release(request.idempotencyScope(), request.getIdempotencyKey(), fingerprint);
            throw e;
        }
        idempotencyService.storeResult(request.idempotencyScope(), request.getIdempotencyKey(),
                fingerprint, outcome.getStatus(), outcome.getBody());
        log.debug("Mutation completed: operation={}, identity={}, status={}",
                request.getOperation(), request.getIdentity(), outcome.getStatus());
        return outcome;
    }
}
