package com.studystats.model;

import lombok.Value;

import java.time.Instant;

@Value
public class TimeInterval {

    Instant start;
    Instant end;

    public double hours() {
        return CalendarEvent.hoursBetween(start, end);
    }
}
