package com.company.querylog.util;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.Locale;

public final class TimeUtils {

    private TimeUtils() {
    }

    /**
     * Parse an ISO-8601 date-time. Offsets and zone ids are honoured; a value without
     * either is read as UTC.
     *
     * @throws DateTimeException when the value is not ISO-8601
     */
    public static Instant parseIsoInstant(String value) {
        if (value == null) {
            throw new DateTimeException("Timestamp is missing");
        }
        TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parse(value.trim());
        if (parsed.isSupported(ChronoField.OFFSET_SECONDS) || parsed.isSupported(ChronoField.INSTANT_SECONDS)) {
            return Instant.from(parsed);
        }
        return LocalDateTime.from(parsed).toInstant(ZoneOffset.UTC);
    }

    public static String formatIso(Instant instant) {
        if (instant == null) return null;
        return DateTimeFormatter.ISO_INSTANT.format(instant);
    }

    /**
     * Elapsed milliseconds with three decimals, e.g. {@code 12.5 -> "12.500"}.
     */
    public static String formatElapsed(double elapsedMs) {
        return String.format(Locale.ROOT, "%.3f", elapsedMs);
    }
}
