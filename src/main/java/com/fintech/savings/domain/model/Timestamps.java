package com.fintech.savings.domain.model;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Fixed textual timestamp format used for every date crossing the service boundary.
 *
 * No timezone, no sub-second part.
 */
public final class Timestamps {

    public static final String PATTERN = "yyyy-MM-dd HH:mm:ss";

    public static final DateTimeFormatter FORMATTER = DateTimeFormatter.ofPattern(PATTERN);

    private Timestamps() {
    }

    public static String format(LocalDateTime timestamp) {
        return FORMATTER.format(timestamp);
    }

    public static LocalDateTime parse(String text) {
        return LocalDateTime.parse(text, FORMATTER);
    }
}
