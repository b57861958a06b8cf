package net.ohaasarelay.util;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Formats and parses the compact {@code yyyyMMdd} day keys used in persisted state and logs.
 */
public final class DayKeys {

    private static final DateTimeFormatter DAY_KEY = DateTimeFormatter.BASIC_ISO_DATE;

    private DayKeys() {
    }

    public static String format(LocalDate day) {
        return day.format(DAY_KEY);
    }

    /**
     * @return the parsed day, or empty for blank or malformed input
     */
    public static Optional<LocalDate> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalDate.parse(value.trim(), DAY_KEY));
        } catch (DateTimeParseException ex) {
            return Optional.empty();
        }
    }
}
