package com.studystats.client;

import com.studystats.model.EventPage;
import com.studystats.model.TimeRange;

/**
 * Fetches one page of events from one calendar source.
 *
 * Implementations throw {@link com.studystats.exception.CalendarSessionExpiredException}
 * when the access token is rejected and
 * {@link com.studystats.exception.CalendarFetchException} for every other failure.
 */
public interface CalendarEventClient {

    EventPage fetchPage(String accessToken, String calendarId, TimeRange range,
                        int maxResults, String pageToken);
}
