package com.studystats.service;

import java.sql.SQLException;
import java.util.Locale;

/**
 * Recognizes "the table is not there yet" failures, which are treated as a
 * disabled feature instead of an error. PostgreSQL reports them as SQL state 42P01.
 */
final class StorageErrors {

    private static final String UNDEFINED_TABLE = "42P01";

    private StorageErrors() {
    }

    static boolean isTableMissing(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof SQLException
                    && UNDEFINED_TABLE.equals(((SQLException) current).getSQLState())) {
                return true;
            }
            String message = current.getMessage() == null ? "" : current.getMessage().toLowerCase(Locale.ROOT);
            if (message.contains("does not exist") || message.contains("relation")) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return false;
    }
}
