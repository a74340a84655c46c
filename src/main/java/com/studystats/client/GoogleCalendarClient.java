package com.studystats.client;

import com.studystats.config.StudyStatsProperties;
import com.studystats.exception.CalendarFetchException;
import com.studystats.exception.CalendarSessionExpiredException;
import com.studystats.model.CalendarEvent;
import com.studystats.model.EventPage;
import com.studystats.model.EventTime;
import com.studystats.model.TimeRange;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.*;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.*;

/**
 * Calls the Google Calendar v3 REST API:
 *   GET {baseUrl}/calendars/{calendarId}/events
 *       ?timeMin=..&timeMax=..&maxResults=..&singleEvents=true&orderBy=startTime[&pageToken=..]
 *
 * The access token is passed through untouched as a Bearer credential.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GoogleCalendarClient implements CalendarEventClient {

    private static final List<String> EXPIRED_SESSION_MARKERS = List.of(
            "invalid authentication credentials", "invalid credentials", "login required");

    private final RestTemplate restTemplate;
    private final StudyStatsProperties properties;

    @Override
    public EventPage fetchPage(String accessToken, String calendarId, TimeRange range,
                               int maxResults, String pageToken) {
        URI uri = buildUri(calendarId, range, maxResults, pageToken);

        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(accessToken);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));

        GoogleEventsResponse response;
        try {
            response = restTemplate.exchange(uri, HttpMethod.GET, new HttpEntity<>(headers),
                    GoogleEventsResponse.class).getBody();
        } catch (HttpStatusCodeException e) {
            if (isExpiredSession(e.getStatusCode().value(), e.getResponseBodyAsString())) {
                throw new CalendarSessionExpiredException(
                        "Calendar session expired for calendar " + calendarId, e);
            }
            log.warn("Calendar fetch failed: calendarId={}, status={}", calendarId, e.getStatusCode());
            throw new CalendarFetchException(
                    "Calendar " + calendarId + " returned " + e.getStatusCode().value(), e);
        } catch (RestClientException e) {
            log.warn("Calendar fetch failed: calendarId={}, error={}", calendarId, e.getMessage());
            throw new CalendarFetchException("Failed to reach calendar " + calendarId, e);
        }

        if (response == null) {
            return new EventPage(List.of(), null);
        }
        List<CalendarEvent> events = new ArrayList<>();
        if (response.getItems() != null) {
            for (GoogleEventsResponse.Item item : response.getItems()) {
                events.add(toEvent(item));
            }
        }
        log.debug("Fetched {} events from calendar {} (more={})",
                events.size(), calendarId, response.getNextPageToken() != null);
        return new EventPage(events, response.getNextPageToken());
    }

    private URI buildUri(String calendarId, TimeRange range, int maxResults, String pageToken) {
        Map<String, Object> vars = new HashMap<>();
        vars.put("calendarId", calendarId);
        vars.put("timeMin", range.getFrom().toString());
        vars.put("timeMax", range.getTo().toString());

        UriComponentsBuilder builder = UriComponentsBuilder
                .fromHttpUrl(properties.getCalendar().getBaseUrl())
                .path("/calendars/{calendarId}/events")
                .queryParam("timeMin", "{timeMin}")
                .queryParam("timeMax", "{timeMax}")
                .queryParam("maxResults", maxResults)
                .queryParam("singleEvents", true)
                .queryParam("orderBy", "startTime");
        if (pageToken != null) {
            vars.put("pageToken", pageToken);
            builder.queryParam("pageToken", "{pageToken}");
        }
        return builder.encode().buildAndExpand(vars).toUri();
    }

    private boolean isExpiredSession(int status, String body) {
        if (status == HttpStatus.UNAUTHORIZED.value()) {
            return true;
        }
        String lower = body == null ? "" : body.toLowerCase(Locale.ROOT);
        return EXPIRED_SESSION_MARKERS.stream().anyMatch(lower::contains);
    }

    private CalendarEvent toEvent(GoogleEventsResponse.Item item) {
        return CalendarEvent.builder()
                .id(item.getId())
                .title(item.getSummary())
                .start(toEventTime(item.getStart()))
                .end(toEventTime(item.getEnd()))
                .build();
    }

    private EventTime toEventTime(GoogleEventsResponse.When when) {
        if (when == null) {
            return null;
        }
        try {
            if (when.getDateTime() != null) {
                return EventTime.at(OffsetDateTime.parse(when.getDateTime()).toInstant());
            }
            if (when.getDate() != null) {
                return EventTime.allDay(LocalDate.parse(when.getDate()));
            }
            return null;
        } catch (DateTimeParseException e) {
            throw new CalendarFetchException("Malformed event time from calendar: " + e.getParsedString(), e);
        }
    }
}
