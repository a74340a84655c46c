package com.studystats.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Key-value settings blob synced across a user's devices.
 * payload holds a JSON object of string values.
 */
@Entity
@Table(name = "study_stats_user_sync")
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class UserSyncRecord {

    @Id
    @Column(name = "user_id", nullable = false)
    private String userId;

    @Column(columnDefinition = "TEXT", nullable = false)
    private String payload;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}
