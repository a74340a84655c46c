package com.studystats.exception;

/**
 * The calendar provider rejected the access token. Clients must re-consent.
 */
public class CalendarSessionExpiredException extends CalendarAccessException {

    public CalendarSessionExpiredException(String message, Throwable cause) {
        super(message, cause);
    }
}
