package com.studystats.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;

import java.time.Instant;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class ExamCountdownResponse {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private Boolean ok;

    private String examDate;
    private String countdownStartDate;
    private Instant updatedAt;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private Boolean cloudDisabled;
}
