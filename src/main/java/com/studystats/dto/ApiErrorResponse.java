package com.studystats.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.studystats.exception.ErrorCategory;
import lombok.*;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiErrorResponse {
    private String error;
    private String code;
    private ErrorCategory category;
    private Long retryAfterSeconds;
    private Object details;
}
