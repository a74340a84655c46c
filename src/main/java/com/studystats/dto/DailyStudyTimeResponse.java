package com.studystats.dto;

import lombok.*;

import java.util.List;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class DailyStudyTimeResponse {
    private List<DailyStudyEntry> entries;
    private double averageMonth;
    private double averageWeek;
}
