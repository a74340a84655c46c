package com.studystats.service;

import com.studystats.dto.StudyProjectionRequest;
import com.studystats.dto.StudyProjectionResponse;
import com.studystats.exception.ApiException;
import com.studystats.model.StudyProjection;
import com.studystats.repository.StudyProjectionRepository;
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
 * Reads and upserts a user's study projection.
 *
 * A missing table is not an error: reads answer with empty fields and
 * cloudDisabled=true, writes answer ok=false with cloudDisabled=true.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StudyProjectionService {

    private final StudyProjectionRepository repository;
    private final Clock clock;

    public StudyProjectionResponse get(String userId) {
        Optional<StudyProjection> stored;
        try {
            stored = repository.findById(userId);
        } catch (DataAccessException e) {
            if (StorageErrors.isTableMissing(e)) {
                log.warn("Study projection table missing, serving disabled response");
                return StudyProjectionResponse.builder().cloudDisabled(true).build();
            }
            throw ApiException.upstream("STORAGE_READ_FAILED", "Failed to read study projection.");
        }

        return stored.map(p -> StudyProjectionResponse.builder()
                        .endDate(p.getEndDate().toString())
                        .hoursPerDay(p.getHoursPerDay())
                        .updatedAt(p.getUpdatedAt())
                        .build())
                .orElseGet(StudyProjectionResponse::new);
    }

    public StudyProjectionResponse save(String userId, StudyProjectionRequest request) {
        LocalDate endDate = parseDate(request.getEndDate());
        double hoursPerDay = StudyStatsService.round2(request.getHoursPerDay());
        Instant updatedAt = clock.instant();

        StudyProjectionResponse.StudyProjectionResponseBuilder response = StudyProjectionResponse.builder()
                .endDate(endDate.toString())
                .hoursPerDay(hoursPerDay)
                .updatedAt(updatedAt);

        try {
            repository.save(StudyProjection.builder()
                    .userId(userId)
                    .endDate(endDate)
                    .hoursPerDay(hoursPerDay)
                    .updatedAt(updatedAt)
                    .build());
        } catch (DataAccessException e) {
            if (StorageErrors.isTableMissing(e)) {
                log.warn("Study projection table missing, write not persisted: userId={}", userId);
                return response.ok(false).cloudDisabled(true).build();
            }
            log.error("Failed to save study projection: userId={}, error={}", userId, e.getMessage());
            throw ApiException.upstream("STORAGE_WRITE_FAILED", "Failed to save study projection.");
        }

        log.info("Study projection saved: userId={}, endDate={}, hoursPerDay={}", userId, endDate, hoursPerDay);
        return response.ok(true).build();
    }

    private LocalDate parseDate(String value) {
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException e) {
            throw ApiException.validation("INVALID_END_DATE", "endDate is not a valid date.");
        }
    }
}
