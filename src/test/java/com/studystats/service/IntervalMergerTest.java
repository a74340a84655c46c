package com.studystats.service;

import com.studystats.model.TimeInterval;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IntervalMergerTest {

    private final IntervalMerger merger = new IntervalMerger();

    private static TimeInterval interval(String from, String to) {
        return new TimeInterval(Instant.parse("2024-03-05T" + from + ":00Z"), Instant.parse("2024-03-05T" + to + ":00Z"));
    }

    @Test
    @DisplayName("Overlapping intervals collapse into one")
    void overlapping_shouldMerge() {
        List<TimeInterval> merged = merger.merge(List.of(interval("09:00", "10:00"), interval("09:30", "10:30")));

        assertEquals(List.of(interval("09:00", "10:30")), merged);
        assertEquals(1.5, merger.totalHours(List.of(interval("09:00", "10:00"), interval("09:30", "10:30"))), 1e-9);
    }

    @Test
    @DisplayName("Touching intervals merge")
    void touching_shouldMerge() {
        List<TimeInterval> merged = merger.merge(List.of(interval("09:00", "10:00"), interval("10:00", "11:00")));

        assertEquals(List.of(interval("09:00", "11:00")), merged);
    }

    @Test
    @DisplayName("Contained interval does not shorten the outer one")
    void contained_shouldKeepOuter() {
        List<TimeInterval> merged = merger.merge(List.of(interval("09:00", "12:00"), interval("10:00", "11:00")));

        assertEquals(List.of(interval("09:00", "12:00")), merged);
    }

    @Test
    @DisplayName("Unsorted disjoint input comes back sorted and unmerged")
    void disjoint_shouldSortOnly() {
        List<TimeInterval> merged = merger.merge(List.of(interval("13:00", "14:00"), interval("09:00", "10:00")));

        assertEquals(List.of(interval("09:00", "10:00"), interval("13:00", "14:00")), merged);
        assertEquals(2.0, merger.totalHours(List.of(interval("13:00", "14:00"), interval("09:00", "10:00"))), 1e-9);
    }

    @Test
    @DisplayName("Empty and single inputs pass through")
    void trivialInputs() {
        assertTrue(merger.merge(List.of()).isEmpty());
        assertEquals(List.of(interval("09:00", "10:00")), merger.merge(List.of(interval("09:00", "10:00"))));
        assertEquals(0, merger.totalHours(List.of()));
    }

    @Test
    @DisplayName("Merged total never exceeds the sum of individual durations")
    void mergedTotal_boundedBySum() {
        List<TimeInterval> input = List.of(
                interval("08:00", "09:30"), interval("09:00", "10:00"),
                interval("09:45", "11:00"), interval("12:00", "12:30"), interval("12:15", "12:45"));

        double sum = input.stream().mapToDouble(TimeInterval::hours).sum();
        double merged = merger.totalHours(input);

        assertTrue(merged <= sum);
        assertEquals(3.75, merged, 1e-9);
    }
}
