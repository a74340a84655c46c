package com.studystats.dto;

import lombok.*;

import java.util.List;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class SubjectDistributionResponse {
    private List<SubjectStudyTime> subjectTimes;
    private double totalHours;
    private int numDays;
}
