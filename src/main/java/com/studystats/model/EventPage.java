package com.studystats.model;

import lombok.Value;

import java.util.List;

/**
 * One page of events plus the continuation token for the next one (null on the last page).
 */
@Value
public class EventPage {

    List<CalendarEvent> events;
    String nextPageToken;

    public boolean hasNext() {
        return nextPageToken != null && !nextPageToken.isBlank();
    }
}
