package com.studystats.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.time.LocalDate;

/**
 * A user's study projection target: study {@code hoursPerDay} until {@code endDate}.
 * One row per user, written with upsert semantics (last write wins).
 */
@Entity
@Table(name = "study_stats_projection")
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class StudyProjection {

    @Id
    @Column(name = "user_id", nullable = false)
    private String userId;

    @Column(name = "end_date", nullable = false)
    private LocalDate endDate;

    @Column(name = "hours_per_day", nullable = false)
    private double hoursPerDay;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}
