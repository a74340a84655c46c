package com.studystats.service;

import com.studystats.dto.StudyProjectionRequest;
import com.studystats.dto.StudyProjectionResponse;
import com.studystats.exception.ApiException;
import com.studystats.model.StudyProjection;
import com.studystats.repository.StudyProjectionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.InvalidDataAccessResourceUsageException;
import org.springframework.http.HttpStatus;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class StudyProjectionServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-05T10:15:00Z");

    @Mock private StudyProjectionRepository repository;

    private StudyProjectionService service;

    @BeforeEach
    void setUp() {
        service = new StudyProjectionService(repository, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static InvalidDataAccessResourceUsageException tableMissing() {
        return new InvalidDataAccessResourceUsageException("could not prepare statement",
                new SQLException("ERROR: undefined table", "42P01"));
    }

    @Test
    @DisplayName("Stored projection is returned")
    void get_existing() {
        when(repository.findById("user-1")).thenReturn(Optional.of(StudyProjection.builder()
                .userId("user-1").endDate(LocalDate.of(2026, 6, 30)).hoursPerDay(4.5).updatedAt(NOW).build()));

        StudyProjectionResponse response = service.get("user-1");

        assertEquals("2026-06-30", response.getEndDate());
        assertEquals(4.5, response.getHoursPerDay());
        assertEquals(NOW, response.getUpdatedAt());
        assertNull(response.getCloudDisabled());
    }

    @Test
    @DisplayName("No projection yet gives empty fields")
    void get_missing() {
        when(repository.findById("user-1")).thenReturn(Optional.empty());

        StudyProjectionResponse response = service.get("user-1");

        assertNull(response.getEndDate());
        assertNull(response.getHoursPerDay());
        assertNull(response.getUpdatedAt());
    }

    @Test
    @DisplayName("Missing table reads as a disabled feature")
    void get_tableMissing() {
        when(repository.findById("user-1")).thenThrow(tableMissing());

        StudyProjectionResponse response = service.get("user-1");

        assertTrue(response.getCloudDisabled());
        assertNull(response.getEndDate());
    }

    @Test
    @DisplayName("Other read failures are upstream errors")
    void get_storageDown() {
        when(repository.findById("user-1")).thenThrow(new DataAccessResourceFailureException("connection refused"));

        ApiException e = assertThrows(ApiException.class, () -> service.get("user-1"));
        assertEquals(HttpStatus.BAD_GATEWAY, e.getStatus());
        assertEquals("STORAGE_READ_FAILED", e.getCode());
    }

    @Test
    @DisplayName("Save rounds hours to two decimals and stamps the current time")
    void save_roundsAndStamps() {
        StudyProjectionResponse response = service.save("user-1", new StudyProjectionRequest("2026-06-30", 4.456));

        ArgumentCaptor<StudyProjection> saved = ArgumentCaptor.forClass(StudyProjection.class);
        verify(repository).save(saved.capture());
        assertEquals("user-1", saved.getValue().getUserId());
        assertEquals(LocalDate.of(2026, 6, 30), saved.getValue().getEndDate());
        assertEquals(4.46, saved.getValue().getHoursPerDay());
        assertEquals(NOW, saved.getValue().getUpdatedAt());
        assertTrue(response.getOk());
        assertEquals(4.46, response.getHoursPerDay());
        assertNull(response.getCloudDisabled());
    }

    @Test
    @DisplayName("Save into a missing table answers ok=false instead of failing")
    void save_tableMissing() {
        when(repository.save(any(StudyProjection.class))).thenThrow(tableMissing());

        StudyProjectionResponse response = service.save("user-1", new StudyProjectionRequest("2026-06-30", 3.0));

        assertFalse(response.getOk());
        assertTrue(response.getCloudDisabled());
        assertEquals("2026-06-30", response.getEndDate());
    }

    @Test
    @DisplayName("Other write failures are upstream errors")
    void save_storageDown() {
        when(repository.save(any(StudyProjection.class)))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        ApiException e = assertThrows(ApiException.class,
                () -> service.save("user-1", new StudyProjectionRequest("2026-06-30", 3.0)));
        assertEquals("STORAGE_WRITE_FAILED", e.getCode());
    }

    @Test
    @DisplayName("Impossible calendar dates are rejected")
    void save_invalidDate() {
        ApiException e = assertThrows(ApiException.class,
                () -> service.save("user-1", new StudyProjectionRequest("2026-02-30", 3.0)));

        assertEquals(HttpStatus.BAD_REQUEST, e.getStatus());
        verifyNoInteractions(repository);
    }
}
