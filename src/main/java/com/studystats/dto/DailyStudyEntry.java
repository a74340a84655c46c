package com.studystats.dto;

import lombok.*;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class DailyStudyEntry {
    // YYYY-MM-DD of the logical day
    private String date;
    // e.g. "5 Mar"
    private String label;
    private double hours;
}
