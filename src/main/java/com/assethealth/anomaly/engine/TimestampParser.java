package com.assethealth.anomaly.engine;

import java.text.ParsePosition;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;

/**
 * Lenient timestamp parsing for the formats data historians commonly export.
 * Offsets are dropped; dates without a time are taken at midnight.
 */
public final class TimestampParser {

    private static final List<DateTimeFormatter> LOCAL_DATE_TIME_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            DateTimeFormatter.ofPattern("yyyy-MM-dd H:mm[:ss][.SSS]"),
            DateTimeFormatter.ofPattern("yyyy/MM/dd H:mm[:ss][.SSS]"),
            DateTimeFormatter.ofPattern("M/d/yyyy H:mm[:ss][.SSS]")
    );

    private TimestampParser() {}

    public static Optional<LocalDateTime> parse(String text) {
        if (text == null || text.isBlank()) return Optional.empty();
        String value = text.trim();

        try {
            for (DateTimeFormatter format : LOCAL_DATE_TIME_FORMATS) {
                if (matches(format, value)) {
                    return Optional.of(LocalDateTime.parse(value, format));
                }
            }
            if (matches(DateTimeFormatter.ISO_OFFSET_DATE_TIME, value)) {
                return Optional.of(OffsetDateTime.parse(value).toLocalDateTime());
            }
            if (matches(DateTimeFormatter.ISO_LOCAL_DATE, value)) {
                return Optional.of(LocalDate.parse(value).atStartOfDay());
            }
        } catch (DateTimeParseException e) {
            // well-formed but out of range, e.g. month 13
            return Optional.empty();
        }
        return Optional.empty();
    }

    private static boolean matches(DateTimeFormatter format, String value) {
        ParsePosition position = new ParsePosition(0);
        format.parseUnresolved(value, position);
        return position.getErrorIndex() < 0 && position.getIndex() == value.length();
    }
}
