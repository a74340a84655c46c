package com.studystats.service;

import com.studystats.dto.ExamCountdownRequest;
import com.studystats.dto.ExamCountdownResponse;
import com.studystats.exception.ApiException;
import com.studystats.model.ExamCountdown;
import com.studystats.repository.ExamCountdownRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Reads and upserts a user's exam countdown.
 * Same missing-table handling as {@link StudyProjectionService}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExamCountdownService {

    private final ExamCountdownRepository repository;
    private final Clock clock;

    public ExamCountdownResponse get(String userId) {
        Optional<ExamCountdown> stored;
        try {
            stored = repository.findById(userId);
        } catch (DataAccessException e) {
            if (StorageErrors.isTableMissing(e)) {
                log.warn("Exam countdown table missing, serving disabled response");
                return ExamCountdownResponse.builder().cloudDisabled(true).build();
            }
            throw ApiException.upstream("STORAGE_READ_FAILED", "Failed to read exam countdown.");
        }

        return stored.map(c -> ExamCountdownResponse.builder()
                        .examDate(c.getExamDate().toString())
                        .countdownStartDate(c.getCountdownStartDate().toString())
                        .updatedAt(c.getUpdatedAt())
                        .build())
                .orElseGet(ExamCountdownResponse::new);
    }

    public ExamCountdownResponse save(String userId, ExamCountdownRequest request) {
        LocalDate examDate = parseDate(request.getExamDate(), "INVALID_EXAM_DATE", "examDate");
        LocalDate startDate = parseDate(request.getCountdownStartDate(),
                "INVALID_COUNTDOWN_START_DATE", "countdownStartDate");
        Instant updatedAt = clock.instant();

        ExamCountdownResponse.ExamCountdownResponseBuilder response = ExamCountdownResponse.builder()
                .examDate(examDate.toString())
                .countdownStartDate(startDate.toString())
                .updatedAt(updatedAt);

        try {
            repository.save(ExamCountdown.builder()
                    .userId(userId)
                    .examDate(examDate)
                    .countdownStartDate(startDate)
                    .updatedAt(updatedAt)
                    .build());
        } catch (DataAccessException e) {
            if (StorageErrors.isTableMissing(e)) {
                log.warn("Exam countdown table missing, write not persisted: userId={}", userId);
                return response.ok(false).cloudDisabled(true).build();
            }
            log.error("Failed to save exam countdown: userId={}, error={}", userId, e.getMessage());
            throw ApiException.upstream("STORAGE_WRITE_FAILED", "Failed to save exam countdown.");
        }

        log.info("Exam countdown saved: userId={}, examDate={}, countdownStartDate={}", userId, examDate, startDate);
        return response.ok(true).build();
    }

    private LocalDate parseDate(String value, String code, String field) {
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException e) {
            throw ApiException.validation(code, field + " is not a valid date.");
        }
    }
}
