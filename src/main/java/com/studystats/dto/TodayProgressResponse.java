package com.studystats.dto;

import lombok.*;

/**
 * Hours planned and completed in the current logical day.
 * percentageCompleted is 100 when nothing is planned.
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class TodayProgressResponse {
    private double totalPlanned;
    private double totalCompleted;
    private double percentageCompleted;
}
