package com.studystats.controller;

import com.studystats.dto.DailyStudyTimeResponse;
import com.studystats.dto.SubjectDistributionResponse;
import com.studystats.dto.TodayProgressResponse;
import com.studystats.exception.ApiException;
import com.studystats.exception.CalendarAccessException;
import com.studystats.exception.CalendarSessionExpiredException;
import com.studystats.service.StudyStatsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.function.Supplier;

/**
 * Calendar-backed statistics. The calendar access token arrives as
 * "Authorization: Bearer {token}".
 *
 * GET /api/today-progress?calendarIds=a,b
 * GET /api/daily-study-time?calendarIds=a,b&days=30&subject=Maths
 * GET /api/distribution?calendarIds=a,b&days=365
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class StatsController {

    static final String STATS_CACHE_CONTROL = "private, max-age=30, stale-while-revalidate=120";
    static final String DISTRIBUTION_CACHE_CONTROL = "private, max-age=60, stale-while-revalidate=180";

    private final StudyStatsService statsService;

    @GetMapping("/today-progress")
    public ResponseEntity<TodayProgressResponse> todayProgress(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestParam(required = false) String calendarIds) {
        String token = calendarToken(authorization);
        TodayProgressResponse body = callCalendar("TODAY_PROGRESS_UPSTREAM_FAILED",
                "Failed to calculate today's progress.",
                () -> statsService.todayProgress(token, RequestHeaders.splitIds(calendarIds)));
        return ResponseEntity.ok().header(HttpHeaders.CACHE_CONTROL, STATS_CACHE_CONTROL).body(body);
    }

    @GetMapping("/daily-study-time")
    public ResponseEntity<DailyStudyTimeResponse> dailyStudyTime(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestParam(required = false) String calendarIds,
            @RequestParam(required = false) Integer days,
            @RequestParam(required = false) String subject) {
        String token = calendarToken(authorization);
        int numDays = RequestHeaders.requireDays(days, 30, 730);
        String subjectFilter = RequestHeaders.optionalSubject(subject);
        DailyStudyTimeResponse body = callCalendar("DAILY_STUDY_TIME_UPSTREAM_FAILED",
                "Failed to calculate daily study time.",
                () -> statsService.dailyStudyTime(token, RequestHeaders.splitIds(calendarIds), numDays, subjectFilter));
        return ResponseEntity.ok().header(HttpHeaders.CACHE_CONTROL, STATS_CACHE_CONTROL).body(body);
    }

    @GetMapping("/distribution")
    public ResponseEntity<SubjectDistributionResponse> distribution(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestParam(required = false) String calendarIds,
            @RequestParam(required = false) Integer days) {
        String token = calendarToken(authorization);
        int numDays = RequestHeaders.requireDays(days, 365, 3650);
        SubjectDistributionResponse body = callCalendar("DISTRIBUTION_UPSTREAM_FAILED",
                "Failed to calculate subject distribution.",
                () -> statsService.subjectDistribution(token, RequestHeaders.splitIds(calendarIds), numDays));
        return ResponseEntity.ok().header(HttpHeaders.CACHE_CONTROL, DISTRIBUTION_CACHE_CONTROL).body(body);
    }

    private static String calendarToken(String authorization) {
        return RequestHeaders.requireBearer(authorization, "UNAUTHORIZED", "UNAUTHORIZED", "Unauthorized");
    }

    private static <T> T callCalendar(String upstreamCode, String message, Supplier<T> call) {
        try {
            return call.get();
        } catch (CalendarSessionExpiredException e) {
            throw ApiException.unauthorized("GOOGLE_SESSION_EXPIRED",
                    "Google session expired. Sign out and sign in with Google again.");
        } catch (CalendarAccessException e) {
            log.error("Calendar fetch failed ({}): {}", upstreamCode, e.getMessage());
            throw ApiException.upstream(upstreamCode, message);
        }
    }
}
