package com.studystats.model;

import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;

/**
 * A 24-hour window starting at the configured day-start hour.
 * {@code end} is inclusive: start + 24h - 1ms.
 */
@Value
public class LogicalDay {

    LocalDate anchorDate;
    Instant start;
    Instant end;

    public TimeRange toRange() {
        return new TimeRange(start, end);
    }
}
