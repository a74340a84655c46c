package com.studystats.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Centralizes calendar, subject and request-safety configuration.
 *
 * Bound from application.yml under "studystats" prefix:
 *   studystats:
 *     zone: Europe/London
 *     day-start-hour: 3
 *     calendar:
 *       default-ids: primary
 *       page-size: 500
 *       max-events-per-calendar: 5000
 *       max-concurrency: 6
 *     subjects:
 *       Maths: maths, math, mathematics
 *       "[Computer Science]": computer science, comp sci
 *     safety:
 *       store: memory
 *       idempotency-ttl: 10m
 *       rate-limits:
 *         study-projection-put: { limit: 30, window: 60s }
 *
 * Subject order matters: classification takes the first subject whose
 * keywords match, so the map keeps insertion order.
 */
@Component
@ConfigurationProperties(prefix = "studystats")
@Getter
@Setter
public class StudyStatsProperties {

    /** Zone used for logical-day arithmetic. Blank means the JVM default zone. */
    private String zone = "";

    private int dayStartHour = 3;

    private Calendar calendar = new Calendar();
    private UserStore userStore = new UserStore();
    private Safety safety = new Safety();
    private Map<String, List<String>> subjects = new LinkedHashMap<>();

    public ZoneId zoneId() {
        return zone == null || zone.isBlank() ? ZoneId.systemDefault() : ZoneId.of(zone.trim());
    }

    @Getter
    @Setter
    public static class Calendar {
        private String baseUrl = "https://www.googleapis.com/calendar/v3";
        private List<String> defaultIds = new ArrayList<>();
        private int pageSize = 500;
        private int maxEventsPerCalendar = 5000;
        private int maxConcurrency = 6;
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(20);
    }

    @Getter
    @Setter
    public static class UserStore {
        private String url = "";
        private String serviceKey = "";
    }

    @Getter
    @Setter
    public static class Safety {
        /** "memory" for a process-local store, "redis" to share state across instances. */
        private String store = "memory";
        private String redisKeyPrefix = "studystats:";
        private Duration idempotencyTtl = Duration.ofMinutes(10);
        private Map<String, RateLimit> rateLimits = new LinkedHashMap<>();

        public RateLimit rateLimitFor(String operation) {
            return rateLimits.getOrDefault(operation, new RateLimit());
        }
    }

    @Getter
    @Setter
    public static class RateLimit {
        private int limit = 30;
        private Duration window = Duration.ofSeconds(60);
    }
}
