package com.studystats.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.*;

import java.util.List;

/**
 * Subset of the Google Calendar "events.list" response we read.
 *
 * {
 *   "items": [
 *     {"id": "abc", "summary": "Maths HW",
 *      "start": {"dateTime": "2024-03-05T09:00:00Z"},
 *      "end":   {"dateTime": "2024-03-05T10:00:00Z"}},
 *     {"id": "def", "summary": "Exam", "start": {"date": "2024-03-06"}, "end": {"date": "2024-03-07"}}
 *   ],
 *   "nextPageToken": "CigKGj..."
 * }
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class GoogleEventsResponse {

    private List<Item> items;
    private String nextPageToken;

    @Getter @Setter @NoArgsConstructor @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Item {
        private String id;
        private String summary;
        private When start;
        private When end;
    }

    @Getter @Setter @NoArgsConstructor @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class When {
        private String dateTime;
        private String date;
    }
}
