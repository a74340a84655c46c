package com.studystats.service;

import com.studystats.client.CalendarEventClient;
import com.studystats.config.StudyStatsProperties;
import com.studystats.exception.CalendarFetchException;
import com.studystats.model.CalendarEvent;
import com.studystats.model.TimeRange;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fetches events from several calendars in parallel.
 *
 * FLOW:
 *   calendarIds → trim, drop blanks, dedupe
 *                      ↓
 *   start min(maxConcurrency, calendarCount) workers on a request-scoped pool
 *                      ↓
 *   each worker: claim next calendar from a shared cursor → page through it → append
 *                      ↓
 *   wait for all workers; the first failure cancels the rest and is rethrown
 *
 * Result order across calendars is unspecified.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MultiCalendarFetcher {

    private final CalendarEventClient calendarEventClient;
    private final StudyStatsProperties properties;

    public List<CalendarEvent> fetchAll(String accessToken, Collection<String> calendarIds, TimeRange range) {
        List<String> uniqueIds = uniqueIds(calendarIds);
        if (uniqueIds.isEmpty()) {
            return List.of();
        }

        int workers = Math.max(1, Math.min(properties.getCalendar().getMaxConcurrency(), uniqueIds.size()));
        AtomicInteger cursor = new AtomicInteger();
        Queue<CalendarEvent> results = new ConcurrentLinkedQueue<>();

        ExecutorService pool = Executors.newFixedThreadPool(workers, new FetchThreadFactory());
        CompletionService<Void> completion = new ExecutorCompletionService<>(pool);
        try {
            for (int i = 0; i < workers; i++) {
                completion.submit(() -> {
                    int index;
                    while ((index = cursor.getAndIncrement()) < uniqueIds.size()) {
                        if (Thread.currentThread().isInterrupted()) {
                            return null;
                        }
                        results.addAll(fetchCalendar(accessToken, uniqueIds.get(index), range));
                    }
                    return null;
                });
            }
            for (int i = 0; i < workers; i++) {
                completion.take().get();
            }
        } catch (ExecutionException e) {
            throw unwrap(e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CalendarFetchException("Calendar fetch interrupted", e);
        } finally {
            pool.shutdownNow();
        }

        log.debug("Fetched {} events from {} calendars with {} workers",
                results.size(), uniqueIds.size(), workers);
        return new ArrayList<>(results);
    }

    List<CalendarEvent> fetchCalendar(String accessToken, String calendarId, TimeRange range) {
        CalendarEventPages pages = new CalendarEventPages(calendarEventClient, accessToken, calendarId, range,
                properties.getCalendar().getPageSize(), properties.getCalendar().getMaxEventsPerCalendar());
        List<CalendarEvent> events = new ArrayList<>();
        pages.forEach(events::add);
        return events;
    }

    static List<String> uniqueIds(Collection<String> calendarIds) {
        if (calendarIds == null) {
            return List.of();
        }
        Set<String> unique = new LinkedHashSet<>();
        for (String id : calendarIds) {
            if (id != null && !id.isBlank()) {
                unique.add(id.trim());
            }
        }
        return new ArrayList<>(unique);
    }

    private RuntimeException unwrap(Throwable cause) {
        if (cause instanceof RuntimeException) {
            return (RuntimeException) cause;
        }
        return new CalendarFetchException("Calendar fetch failed: " + cause.getMessage(), cause);
    }

    private static final class FetchThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "calendar-fetch-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
