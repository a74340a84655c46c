package com.studystats.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.*;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class ExamCountdownRequest {

    @NotNull(message = "examDate is required")
    @Pattern(regexp = "^\\d{4}-\\d{2}-\\d{2}$", message = "examDate must be YYYY-MM-DD")
    private String examDate;

    @NotNull(message = "countdownStartDate is required")
    @Pattern(regexp = "^\\d{4}-\\d{2}-\\d{2}$", message = "countdownStartDate must be YYYY-MM-DD")
    private String countdownStartDate;
}
