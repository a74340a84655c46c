package com.studystats.service;

import com.studystats.config.StudyStatsProperties;
import com.studystats.model.LogicalDay;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Computes "logical day" windows: days that start at a fixed hour (default 03:00)
 * instead of midnight, so late-night study still counts toward the previous day.
 *
 * Example with dayStartHour = 3:
 *   2024-03-05 01:30 → [2024-03-04 03:00, 2024-03-05 02:59:59.999]
 *   2024-03-05 03:00 → [2024-03-05 03:00, 2024-03-06 02:59:59.999]
 */
@Component
public class LogicalDayCalculator {

    private final ZoneId zone;
    private final int dayStartHour;

    @Autowired
    public LogicalDayCalculator(StudyStatsProperties properties) {
        this(properties.zoneId(), properties.getDayStartHour());
    }

    public LogicalDayCalculator(ZoneId zone, int dayStartHour) {
        if (dayStartHour < 0 || dayStartHour > 23) {
            throw new IllegalArgumentException("dayStartHour must be within [0, 23]: " + dayStartHour);
        }
        this.zone = zone;
        this.dayStartHour = dayStartHour;
    }

    public LogicalDay boundaries(Instant instant) {
        ZonedDateTime local = instant.atZone(zone);
        LocalDate anchor = local.getHour() < dayStartHour
                ? local.toLocalDate().minusDays(1)
                : local.toLocalDate();
        return forAnchor(anchor);
    }

    public LogicalDay forAnchor(LocalDate anchor) {
        ZonedDateTime start = anchor.atTime(dayStartHour, 0).atZone(zone);
        Instant startInstant = start.toInstant();
        Instant endInstant = startInstant.plusMillis(24L * 60 * 60 * 1000 - 1);
        return new LogicalDay(anchor, startInstant, endInstant);
    }

    public ZoneId zone() {
        return zone;
    }
}
