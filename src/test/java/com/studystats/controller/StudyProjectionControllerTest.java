package com.studystats.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.studystats.client.UserStoreClient;
import com.studystats.config.RequestCorrelationInterceptor;
import com.studystats.config.StudyStatsProperties;
import com.studystats.dto.StudyProjectionRequest;
import com.studystats.dto.StudyProjectionResponse;
import com.studystats.exception.ApiException;
import com.studystats.service.IdempotencyService;
import com.studystats.service.RateLimiter;
import com.studystats.service.RequestSafetyService;
import com.studystats.service.StudyProjectionService;
import com.studystats.store.InMemoryKeyValueStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Runs the controller against the real safety layer (in-memory stores) so replay,
 * conflict and rate-limit responses are checked end to end.
 */
@ExtendWith(MockitoExtension.class)
class StudyProjectionControllerTest {

    private static final String BODY = "{\"endDate\": \"2026-06-30\", \"hoursPerDay\": 4.5}";

    @Mock private UserStoreClient userStoreClient;
    @Mock private StudyProjectionService projectionService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-03-05T10:15:00Z"), ZoneOffset.UTC);
        StudyStatsProperties properties = new StudyStatsProperties();
        StudyStatsProperties.RateLimit limit = new StudyStatsProperties.RateLimit();
        limit.setLimit(3);
        limit.setWindow(Duration.ofSeconds(60));
        properties.getSafety().getRateLimits().put("study-projection-put", limit);

        RequestSafetyService safetyService = new RequestSafetyService(
                new RateLimiter(new InMemoryKeyValueStore<>(clock), clock),
                new IdempotencyService(new InMemoryKeyValueStore<>(clock),
                        new ObjectMapper().findAndRegisterModules(), properties, clock),
                properties);

        mockMvc = MockMvcBuilders
                .standaloneSetup(new StudyProjectionController(userStoreClient, projectionService, safetyService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .addInterceptors(new RequestCorrelationInterceptor())
                .build();
    }

    private void signedIn() {
        when(userStoreClient.resolveUserId("user-token")).thenReturn("user-1");
    }

    private void saveSucceeds() {
        when(projectionService.save(eq("user-1"), any(StudyProjectionRequest.class)))
                .thenReturn(StudyProjectionResponse.builder().ok(true).endDate("2026-06-30").hoursPerDay(4.5).build());
    }

    @Nested
    @DisplayName("Authentication")
    class Authentication {

        @Test
        @DisplayName("No Authorization header is MISSING_BEARER_TOKEN")
        void missingHeader() throws Exception {
            mockMvc.perform(get("/api/study-projection"))
                    .andExpect(status().isUnauthorized())
                    .andExpect(jsonPath("$.code").value("MISSING_BEARER_TOKEN"));
        }

        @Test
        @DisplayName("Blank bearer token is EMPTY_BEARER_TOKEN")
        void emptyToken() throws Exception {
            mockMvc.perform(get("/api/study-projection").header(HttpHeaders.AUTHORIZATION, "Bearer    "))
                    .andExpect(status().isUnauthorized())
                    .andExpect(jsonPath("$.code").value("EMPTY_BEARER_TOKEN"));
        }

        @Test
        @DisplayName("Token rejected by the user store is INVALID_BEARER_TOKEN")
        void invalidToken() throws Exception {
            when(userStoreClient.resolveUserId("forged"))
                    .thenThrow(ApiException.unauthorized("INVALID_BEARER_TOKEN", "Invalid authentication token."));

            mockMvc.perform(put("/api/study-projection")
                            .header(HttpHeaders.AUTHORIZATION, "Bearer forged")
                            .contentType(MediaType.APPLICATION_JSON).content(BODY))
                    .andExpect(status().isUnauthorized())
                    .andExpect(jsonPath("$.code").value("INVALID_BEARER_TOKEN"));

            verifyNoInteractions(projectionService);
        }
    }

    @Test
    @DisplayName("GET returns the stored projection")
    void getProjection() throws Exception {
        signedIn();
        when(projectionService.get("user-1")).thenReturn(
                StudyProjectionResponse.builder().endDate("2026-06-30").hoursPerDay(4.5).build());

        mockMvc.perform(get("/api/study-projection").header(HttpHeaders.AUTHORIZATION, "Bearer user-token"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.endDate").value("2026-06-30"))
                .andExpect(jsonPath("$.hoursPerDay").value(4.5))
                .andExpect(jsonPath("$.cloudDisabled").doesNotExist());
    }

    @Nested
    @DisplayName("Idempotent PUT")
    class IdempotentPut {

        @Test
        @DisplayName("Retry with the same key and body replays without writing again")
        void replay() throws Exception {
            signedIn();
            saveSucceeds();

            mockMvc.perform(put("/api/study-projection")
                            .header(HttpHeaders.AUTHORIZATION, "Bearer user-token")
                            .header("Idempotency-Key", "retry-1")
                            .contentType(MediaType.APPLICATION_JSON).content(BODY))
                    .andExpect(status().isOk())
                    .andExpect(header().doesNotExist("X-Idempotent-Replay"))
                    .andExpect(jsonPath("$.ok").value(true));

            mockMvc.perform(put("/api/study-projection")
                            .header(HttpHeaders.AUTHORIZATION, "Bearer user-token")
                            .header("Idempotency-Key", "retry-1")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"hoursPerDay\": 4.5, \"endDate\": \"2026-06-30\"}"))
                    .andExpect(status().isOk())
                    .andExpect(header().string("X-Idempotent-Replay", "true"))
                    .andExpect(jsonPath("$.ok").value(true))
                    .andExpect(jsonPath("$.hoursPerDay").value(4.5));

            verify(projectionService, times(1)).save(eq("user-1"), any(StudyProjectionRequest.class));
        }

        @Test
        @DisplayName("Same key with a different body is 409")
        void conflict() throws Exception {
            signedIn();
            saveSucceeds();

            mockMvc.perform(put("/api/study-projection")
                            .header(HttpHeaders.AUTHORIZATION, "Bearer user-token")
                            .header("Idempotency-Key", "retry-1")
                            .contentType(MediaType.APPLICATION_JSON).content(BODY))
                    .andExpect(status().isOk());

            mockMvc.perform(put("/api/study-projection")
                            .header(HttpHeaders.AUTHORIZATION, "Bearer user-token")
                            .header("Idempotency-Key", "retry-1")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"endDate\": \"2026-07-01\", \"hoursPerDay\": 4.5}"))
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.code").value("IDEMPOTENCY_KEY_REUSED"))
                    .andExpect(jsonPath("$.category").value("conflict"));

            verify(projectionService, times(1)).save(eq("user-1"), any(StudyProjectionRequest.class));
        }

        @Test
        @DisplayName("Requests without a key always write")
        void noKey() throws Exception {
            signedIn();
            saveSucceeds();

            for (int i = 0; i < 2; i++) {
                mockMvc.perform(put("/api/study-projection")
                                .header(HttpHeaders.AUTHORIZATION, "Bearer user-token")
                                .contentType(MediaType.APPLICATION_JSON).content(BODY))
                        .andExpect(status().isOk())
                        .andExpect(header().doesNotExist("X-Idempotent-Replay"));
            }

            verify(projectionService, times(2)).save(eq("user-1"), any(StudyProjectionRequest.class));
        }
    }

    @Test
    @DisplayName("The request after the limit is 429 with Retry-After")
    void rateLimited() throws Exception {
        signedIn();
        saveSucceeds();
        for (int i = 0; i < 3; i++) {
            mockMvc.perform(put("/api/study-projection")
                            .header(HttpHeaders.AUTHORIZATION, "Bearer user-token")
                            .contentType(MediaType.APPLICATION_JSON).content(BODY))
                    .andExpect(status().isOk());
        }

        mockMvc.perform(put("/api/study-projection")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer user-token")
                        .contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().string(HttpHeaders.RETRY_AFTER, "60"))
                .andExpect(jsonPath("$.code").value("RATE_LIMITED"))
                .andExpect(jsonPath("$.category").value("rate_limit"))
                .andExpect(jsonPath("$.retryAfterSeconds").value(60));

        verify(projectionService, times(3)).save(eq("user-1"), any(StudyProjectionRequest.class));
    }

    @Nested
    @DisplayName("Body validation (runs before the user store is consulted)")
    class BodyValidation {

        @Test
        @DisplayName("hoursPerDay above 24 is rejected")
        void hoursTooHigh() throws Exception {
            mockMvc.perform(put("/api/study-projection")
                            .header(HttpHeaders.AUTHORIZATION, "Bearer user-token")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"endDate\": \"2026-06-30\", \"hoursPerDay\": 25}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"))
                    .andExpect(jsonPath("$.details[0].path").value("hoursPerDay"));
        }

        @Test
        @DisplayName("endDate must look like YYYY-MM-DD")
        void badDateFormat() throws Exception {
            mockMvc.perform(put("/api/study-projection")
                            .header(HttpHeaders.AUTHORIZATION, "Bearer user-token")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"endDate\": \"30/06/2026\", \"hoursPerDay\": 2}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
        }

        @Test
        @DisplayName("Malformed JSON is INVALID_JSON")
        void malformedJson() throws Exception {
            mockMvc.perform(put("/api/study-projection")
                            .header(HttpHeaders.AUTHORIZATION, "Bearer user-token")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"endDate\": "))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.code").value("INVALID_JSON"));
        }
    }
}
