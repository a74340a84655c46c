package com.studystats.dto;

import lombok.*;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class SubjectStudyTime {
    private String subject;
    private double hours;
}
