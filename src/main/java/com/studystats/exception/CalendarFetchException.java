package com.studystats.exception;

/**
 * Any calendar fetch failure that is not an expired session:
 * network errors, provider-side errors, interrupted fan-out.
 */
public class CalendarFetchException extends CalendarAccessException {

    public CalendarFetchException(String message) {
        super(message);
    }

    public CalendarFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
