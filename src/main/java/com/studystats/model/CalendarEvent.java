package com.studystats.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * A read-only event fetched from a calendar source.
 *
 * All-day events (date-only start) never contribute to duration math:
 * both {@link #durationHours()} and {@link #completedHours(Instant)} return 0 for them.
 */
@Value
@Builder
public class CalendarEvent {

    private static final double MILLIS_PER_HOUR = 3_600_000d;

    String id;
    String title;
    EventTime start;
    EventTime end;

    public boolean isAllDay() {
        return start == null || start.getDateTime() == null;
    }

    /**
     * True when both ends are precise instants, the only shape that can become an interval.
     */
    public boolean isTimed() {
        return !isAllDay() && end != null && end.getDateTime() != null;
    }

    public Instant startInstant() {
        return start.getDateTime();
    }

    public Instant endInstant() {
        return end.getDateTime();
    }

    public TimeInterval toInterval() {
        return new TimeInterval(startInstant(), endInstant());
    }

    public double durationHours() {
        if (!isTimed()) {
            return 0;
        }
        return hoursBetween(startInstant(), endInstant());
    }

    /**
     * Hours of this event already elapsed at {@code now}: 0 when it has not started,
     * the part up to {@code now} while running, the full duration once finished.
     */
    public double completedHours(Instant now) {
        if (!isTimed()) {
            return 0;
        }
        Instant startAt = startInstant();
        if (startAt.isAfter(now)) {
            return 0;
        }
        Instant endAt = endInstant();
        Instant effectiveEnd = endAt.isBefore(now) ? endAt : now;
        return hoursBetween(startAt, effectiveEnd);
    }

    static double hoursBetween(Instant from, Instant to) {
        return Duration.between(from, to).toMillis() / MILLIS_PER_HOUR;
    }
}
