package com.studystats.dto;

import jakarta.validation.constraints.NotNull;
import lombok.*;

import java.util.Map;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class AccountSyncRequest {

    // Client-side settings, key → serialized value
    @NotNull(message = "payload is required")
    private Map<String, String> payload;
}
