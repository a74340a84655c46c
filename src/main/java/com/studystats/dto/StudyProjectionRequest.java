package com.studystats.dto;

import jakarta.validation.constraints.*;
import lombok.*;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class StudyProjectionRequest {

    @NotNull(message = "endDate is required")
    @Pattern(regexp = "^\\d{4}-\\d{2}-\\d{2}$", message = "endDate must be YYYY-MM-DD")
    private String endDate;

    @NotNull(message = "hoursPerDay is required")
    @DecimalMin(value = "0", message = "hoursPerDay must be >= 0")
    @DecimalMax(value = "24", message = "hoursPerDay must be <= 24")
    private Double hoursPerDay;
}
