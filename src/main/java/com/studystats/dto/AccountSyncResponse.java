package com.studystats.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;

import java.time.Instant;
import java.util.Map;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class AccountSyncResponse {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private Boolean ok;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private Map<String, String> payload;

    private Instant updatedAt;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private Boolean cloudDisabled;
}
