package com.studystats.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.studystats.config.StudyStatsProperties;
import com.studystats.exception.ApiException;
import lombok.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.*;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Resolves a user-store access token to a user id:
 *   GET {userStore.url}/auth/v1/user
 *   Authorization: Bearer {token}, apikey: {serviceKey}
 *   → {"id": "...", ...}
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class UserStoreClient {

    private final RestTemplate restTemplate;
    private final StudyStatsProperties properties;

    public String resolveUserId(String accessToken) {
        StudyStatsProperties.UserStore userStore = properties.getUserStore();
        if (userStore.getUrl() == null || userStore.getUrl().isBlank()) {
            throw ApiException.internal("USER_STORE_NOT_CONFIGURED", "User store is not configured.");
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(accessToken);
        headers.set("apikey", userStore.getServiceKey());
        headers.setAccept(java.util.List.of(MediaType.APPLICATION_JSON));

        UserResponse user;
        try {
            user = restTemplate.exchange(userStore.getUrl() + "/auth/v1/user", HttpMethod.GET,
                    new HttpEntity<>(headers), UserResponse.class).getBody();
        } catch (HttpStatusCodeException e) {
            if (e.getStatusCode().is4xxClientError()) {
                throw ApiException.unauthorized("INVALID_BEARER_TOKEN", "Invalid authentication token.");
            }
            log.error("User store returned {}", e.getStatusCode());
            throw ApiException.upstream("USER_STORE_UNAVAILABLE", "Could not verify authentication token.");
        } catch (RestClientException e) {
            log.error("User store unreachable: {}", e.getMessage());
            throw ApiException.upstream("USER_STORE_UNAVAILABLE", "Could not verify authentication token.");
        }

        if (user == null || user.getId() == null || user.getId().isBlank()) {
            throw ApiException.unauthorized("INVALID_BEARER_TOKEN", "Invalid authentication token.");
        }
        return user.getId();
    }

    @Getter @Setter @NoArgsConstructor @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class UserResponse {
        private String id;
        private String email;
    }
}
