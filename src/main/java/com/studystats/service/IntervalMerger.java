package com.studystats.service;

import com.studystats.model.TimeInterval;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Merges overlapping or touching intervals so planned time is not counted twice.
 *
 *   [09:00-10:00] + [09:30-10:30] + [11:00-12:00]
 *   → [09:00-10:30] + [11:00-12:00]
 */
@Component
public class IntervalMerger {

    public List<TimeInterval> merge(List<TimeInterval> intervals) {
        if (intervals.size() <= 1) {
            return intervals;
        }

        List<TimeInterval> sorted = new ArrayList<>(intervals);
        sorted.sort(Comparator.comparing(TimeInterval::getStart));

        List<TimeInterval> merged = new ArrayList<>();
        merged.add(sorted.get(0));

        for (int i = 1; i < sorted.size(); i++) {
            TimeInterval current = sorted.get(i);
            TimeInterval last = merged.get(merged.size() - 1);

            if (!current.getStart().isAfter(last.getEnd())) {
                // Touching counts as overlapping
                TimeInterval extended = current.getEnd().isAfter(last.getEnd())
                        ? new TimeInterval(last.getStart(), current.getEnd())
                        : last;
                merged.set(merged.size() - 1, extended);
            } else {
                merged.add(current);
            }
        }
        return merged;
    }

    public double totalHours(List<TimeInterval> intervals) {
        return merge(intervals).stream().mapToDouble(TimeInterval::hours).sum();
    }
}
