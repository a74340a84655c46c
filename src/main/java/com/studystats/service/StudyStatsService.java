package com.studystats.service;

import com.studystats.config.StudyStatsProperties;
import com.studystats.dto.*;
import com.studystats.model.CalendarEvent;
import com.studystats.model.LogicalDay;
import com.studystats.model.TimeInterval;
import com.studystats.model.TimeRange;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.*;

/**
 * Turns calendar events into study statistics.
 *
 * All three statistics share the same filtering:
 *   - all-day events (and events without a timed end) never count toward durations
 *   - only events whose title matches a configured subject are counted
 *
 * TODAY PROGRESS:
 *   planned   = merged intervals of today's matching events (overlaps counted once)
 *   completed = per-event elapsed time, NOT merged (overlaps counted twice)
 *
 * DAILY STUDY TIME:
 *   one bucket per logical day; today's bucket only counts elapsed time
 *
 * SUBJECT DISTRIBUTION:
 *   full event durations credited to the first matching subject
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StudyStatsService {

    private static final DateTimeFormatter LABEL_FORMAT = DateTimeFormatter.ofPattern("d MMM", Locale.UK);
    private static final int WEEK_ENTRIES = 7;

    private final MultiCalendarFetcher fetcher;
    private final LogicalDayCalculator dayCalculator;
    private final IntervalMerger intervalMerger;
    private final SubjectMatcher subjectMatcher;
    private final StudyStatsProperties properties;
    private final Clock clock;

    public TodayProgressResponse todayProgress(String accessToken, List<String> calendarIds) {
        Instant now = clock.instant();
        Map<String, List<String>> subjects = properties.getSubjects();
        LogicalDay today = dayCalculator.boundaries(now);

        List<CalendarEvent> events = fetcher.fetchAll(accessToken, resolveCalendarIds(calendarIds), today.toRange());

        List<TimeInterval> planned = new ArrayList<>();
        double totalCompleted = 0;
        for (CalendarEvent event : events) {
            if (!event.isTimed() || !subjectMatcher.matchesAny(event.getTitle(), subjects)) {
                continue;
            }
            planned.add(event.toInterval());
            totalCompleted += event.completedHours(now);
        }

        double totalPlanned = intervalMerger.totalHours(planned);
        double percentage = totalPlanned == 0 ? 100 : totalCompleted / totalPlanned * 100;

        log.info("Today progress for {}: planned={}h, completed={}h, events={}",
                today.getAnchorDate(), totalPlanned, totalCompleted, planned.size());
        return TodayProgressResponse.builder()
                .totalPlanned(totalPlanned)
                .totalCompleted(totalCompleted)
                .percentageCompleted(percentage)
                .build();
    }

    public DailyStudyTimeResponse dailyStudyTime(String accessToken, List<String> calendarIds,
                                                 int numDays, String subjectFilter) {
        Instant now = clock.instant();
        int days = Math.max(1, numDays);
        Map<String, List<String>> subjects = properties.getSubjects();

        ZonedDateTime localNow = now.atZone(dayCalculator.zone());
        Map<LocalDate, Double> hoursByDay = new LinkedHashMap<>();
        for (int i = days - 1; i >= 0; i--) {
            LogicalDay day = dayCalculator.boundaries(localNow.minusDays(i).toInstant());
            hoursByDay.put(day.getAnchorDate(), 0d);
        }
        LocalDate firstDay = hoursByDay.keySet().iterator().next();
        LocalDate today = dayCalculator.boundaries(now).getAnchorDate();

        TimeRange range = new TimeRange(dayCalculator.forAnchor(firstDay).getStart(), now);
        List<CalendarEvent> events = fetcher.fetchAll(accessToken, resolveCalendarIds(calendarIds), range);

        List<String> filterKeywords = subjectFilter == null ? null : subjects.get(subjectFilter);
        for (CalendarEvent event : events) {
            if (event.isAllDay()) {
                continue;
            }
            boolean matches = subjectFilter != null
                    ? filterKeywords != null && subjectMatcher.matchesSubject(event.getTitle(), filterKeywords)
                    : subjectMatcher.matchesAny(event.getTitle(), subjects);
            if (!matches) {
                continue;
            }

            LocalDate key = dayCalculator.boundaries(event.startInstant()).getAnchorDate();
            if (!hoursByDay.containsKey(key)) {
                continue;
            }
            double hours = key.equals(today) ? event.completedHours(now) : event.durationHours();
            if (hours <= 0) {
                continue;
            }
            hoursByDay.merge(key, hours, Double::sum);
        }

        List<DailyStudyEntry> entries = new ArrayList<>();
        hoursByDay.forEach((date, hours) -> entries.add(DailyStudyEntry.builder()
                .date(date.toString())
                .label(LABEL_FORMAT.format(date))
                .hours(round2(hours))
                .build()));

        List<DailyStudyEntry> weekEntries = entries.subList(Math.max(0, entries.size() - WEEK_ENTRIES), entries.size());
        return DailyStudyTimeResponse.builder()
                .entries(entries)
                .averageMonth(average(entries))
                .averageWeek(average(weekEntries))
                .build();
    }

    public SubjectDistributionResponse subjectDistribution(String accessToken, List<String> calendarIds,
                                                           int numDays) {
        Instant now = clock.instant();
        Map<String, List<String>> subjects = properties.getSubjects();
        Instant from = now.atZone(dayCalculator.zone()).minusDays(numDays).toInstant();

        List<CalendarEvent> events = fetcher.fetchAll(accessToken, resolveCalendarIds(calendarIds),
                new TimeRange(from, now));

        Map<String, Double> hoursBySubject = new LinkedHashMap<>();
        subjects.keySet().forEach(subject -> hoursBySubject.put(subject, 0d));

        for (CalendarEvent event : events) {
            if (event.isAllDay()) {
                continue;
            }
            double duration = event.durationHours();
            subjectMatcher.classify(event.getTitle(), subjects)
                    .ifPresent(subject -> hoursBySubject.merge(subject, duration, Double::sum));
        }

        double total = hoursBySubject.values().stream().mapToDouble(Double::doubleValue).sum();
        List<SubjectStudyTime> subjectTimes = new ArrayList<>();
        hoursBySubject.forEach((subject, hours) -> subjectTimes.add(new SubjectStudyTime(subject, round2(hours))));

        return SubjectDistributionResponse.builder()
                .subjectTimes(subjectTimes)
                .totalHours(round2(total))
                .numDays(numDays)
                .build();
    }

    /**
     * Requested calendars when any are given, otherwise the deployment default list.
     */
    public List<String> resolveCalendarIds(List<String> requested) {
        List<String> cleaned = MultiCalendarFetcher.uniqueIds(requested);
        return cleaned.isEmpty()
                ? MultiCalendarFetcher.uniqueIds(properties.getCalendar().getDefaultIds())
                : cleaned;
    }

    static double round2(double value) {
        return Math.round(value * 100) / 100d;
    }

    private static double average(List<DailyStudyEntry> entries) {
        return entries.stream().mapToDouble(DailyStudyEntry::getHours).average().orElse(0);
    }
}
