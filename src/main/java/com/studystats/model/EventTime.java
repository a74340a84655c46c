package com.studystats.model;

import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Start or end of a calendar event: either a date (all-day events)
 * or a precise instant, never both.
 */
@Value
public class EventTime {

    Instant dateTime;
    LocalDate date;

    public static EventTime at(Instant dateTime) {
        return new EventTime(dateTime, null);
    }

    public static EventTime allDay(LocalDate date) {
        return new EventTime(null, date);
    }

    public boolean isDateOnly() {
        return dateTime == null && date != null;
    }
}
