package com.studystats.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.time.LocalDate;

/**
 * A user's exam countdown: days from {@code countdownStartDate} to {@code examDate}.
 * One row per user, last write wins.
 */
@Entity
@Table(name = "study_stats_exam_countdown")
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class ExamCountdown {

    @Id
    @Column(name = "user_id", nullable = false)
    private String userId;

    @Column(name = "exam_date", nullable = false)
    private LocalDate examDate;

    @Column(name = "countdown_start_date", nullable = false)
    private LocalDate countdownStartDate;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}
