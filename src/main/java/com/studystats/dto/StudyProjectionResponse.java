package com.studystats.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;

import java.time.Instant;

/**
 * Read and write result for the study projection.
 * cloudDisabled=true means storage is not provisioned; nothing was read or persisted.
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class StudyProjectionResponse {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private Boolean ok;

    private String endDate;
    private Double hoursPerDay;
    private Instant updatedAt;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private Boolean cloudDisabled;
}
