package com.studystats.model;

import lombok.Value;

import java.time.Instant;

/**
 * Query window sent to a calendar source (timeMin / timeMax).
 */
@Value
public class TimeRange {

    Instant from;
    Instant to;
}
