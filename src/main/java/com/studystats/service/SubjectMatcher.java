package com.studystats.service;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Matches event titles against subject keywords.
 *
 * Matching is a case-insensitive substring check: "Maths HW" matches keyword "math".
 * When several subjects match, the first one in configuration order wins;
 * an event is never split across subjects.
 */
@Component
public class SubjectMatcher {

    public boolean matchesAny(String title, Map<String, List<String>> subjects) {
        String lower = normalize(title);
        return subjects.values().stream().anyMatch(keywords -> containsAny(lower, keywords));
    }

    public boolean matchesSubject(String title, List<String> keywords) {
        return containsAny(normalize(title), keywords);
    }

    public Optional<String> classify(String title, Map<String, List<String>> subjects) {
        String lower = normalize(title);
        for (Map.Entry<String, List<String>> subject : subjects.entrySet()) {
            if (containsAny(lower, subject.getValue())) {
                return Optional.of(subject.getKey());
            }
        }
        return Optional.empty();
    }

    private boolean containsAny(String lowerTitle, List<String> keywords) {
        if (keywords == null) {
            return false;
        }
        for (String keyword : keywords) {
            if (keyword != null && lowerTitle.contains(keyword.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    private String normalize(String title) {
        return title == null ? "" : title.toLowerCase(Locale.ROOT);
    }
}
