package com.studystats.service;

import com.studystats.client.CalendarEventClient;
import com.studystats.model.CalendarEvent;
import com.studystats.model.EventPage;
import com.studystats.model.TimeRange;

import java.util.Collections;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Lazy view over all events of one calendar in a time range.
 *
 * Pages are requested only as the iterator advances, strictly in order
 * (each request needs the previous page's continuation token). Every call to
 * {@link #iterator()} starts again from the first page.
 *
 * Iteration stops when the source reports no continuation token or when
 * {@code maxEvents} events have been produced. Every request asks for the
 * clamped page size; the tail of the last page past the cap is dropped.
 */
public class CalendarEventPages implements Iterable<CalendarEvent> {

    static final int MIN_PAGE_SIZE = 50;
    static final int MAX_PAGE_SIZE = 1000;

    private final CalendarEventClient client;
    private final String accessToken;
    private final String calendarId;
    private final TimeRange range;
    private final int pageSize;
    private final int maxEvents;

    public CalendarEventPages(CalendarEventClient client, String accessToken, String calendarId,
                              TimeRange range, int pageSize, int maxEvents) {
        this.client = client;
        this.accessToken = accessToken;
        this.calendarId = calendarId;
        this.range = range;
        this.pageSize = clampPageSize(pageSize);
        this.maxEvents = Math.max(this.pageSize, maxEvents);
    }

    static int clampPageSize(int requested) {
        return Math.max(MIN_PAGE_SIZE, Math.min(MAX_PAGE_SIZE, requested));
    }

    int pageSize() {
        return pageSize;
    }

    int maxEvents() {
        return maxEvents;
    }

    @Override
    public Iterator<CalendarEvent> iterator() {
        return new PageIterator();
    }

    private class PageIterator implements Iterator<CalendarEvent> {

        private Iterator<CalendarEvent> current = Collections.emptyIterator();
        private String nextPageToken;
        private boolean exhausted;
        private int produced;

        @Override
        public boolean hasNext() {
            while (!current.hasNext()) {
                if (exhausted || produced >= maxEvents) {
                    return false;
                }
                fetchNextPage();
            }
            return produced < maxEvents;
        }

        @Override
        public CalendarEvent next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            produced++;
            return current.next();
        }

        private void fetchNextPage() {
            EventPage page = client.fetchPage(accessToken, calendarId, range, pageSize, nextPageToken);
            current = page.getEvents() == null
                    ? Collections.emptyIterator()
                    : page.getEvents().iterator();
            nextPageToken = page.getNextPageToken();
            if (!page.hasNext()) {
                exhausted = true;
            }
        }
    }
}
