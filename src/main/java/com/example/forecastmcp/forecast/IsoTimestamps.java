package com.example.forecastmcp.forecast;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

public final class IsoTimestamps {
    public static final DateTimeFormatter OUTPUT_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    private IsoTimestamps() {
    }

    /**
     * Accepts {@code 2021-01-01}, {@code 2021-01-01T10:15[:30]} and the same with a space separator.
     *
     * @throws DateTimeParseException if the text is neither an ISO date nor an ISO local date-time
     */
    public static LocalDateTime parse(String text) {
        String trimmed = text.trim();
        if (trimmed.length() == 10) {
            return LocalDate.parse(trimmed, DateTimeFormatter.ISO_LOCAL_DATE).atStartOfDay();
        }
        return LocalDateTime.parse(trimmed.replace(' ', 'T'), DateTimeFormatter.ISO_LOCAL_DATE_TIME);
    }

    public static String format(LocalDateTime timestamp) {
        return OUTPUT_FORMAT.format(timestamp);
    }
}
