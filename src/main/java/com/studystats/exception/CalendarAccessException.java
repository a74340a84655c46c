package com.studystats.exception;

/**
 * Base class for failures talking to a calendar source.
 */
public abstract class CalendarAccessException extends RuntimeException {

    protected CalendarAccessException(String message) {
        super(message);
    }

    protected CalendarAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
