package com.barvault.core.time;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * UTC time helpers: epoch-nanosecond conversion and lenient parsing of user input.
 */
public final class Timestamps {

    private static final long NANOS_PER_SECOND = 1_000_000_000L;

    private static final DateTimeFormatter SPACE_SEPARATED =
        DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm[:ss][.SSSSSSSSS][.SSSSSS][.SSS]");

    private Timestamps() {
    }

    public static long toEpochNanos(Instant instant) {
        return Math.addExact(Math.multiplyExact(instant.getEpochSecond(), NANOS_PER_SECOND), instant.getNano());
    }

    public static Instant fromEpochNanos(long epochNanos) {
        return Instant.ofEpochSecond(Math.floorDiv(epochNanos, NANOS_PER_SECOND),
            Math.floorMod(epochNanos, NANOS_PER_SECOND));
    }

    /**
     * Parse an instant from text. Accepts ISO instants ("2024-01-02T09:30:00Z"), offset
     * date-times, local date-times with 'T' or a space (taken as UTC), and bare dates
     * ("2024-01-02", taken as midnight UTC).
     *
     * @throws IllegalArgumentException if none of the formats match
     */
    public static Instant parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("timestamp is empty");
        }
        String value = text.trim();
        try {
            if (value.length() == 10) {
                return LocalDate.parse(value).atStartOfDay(ZoneOffset.UTC).toInstant();
            }
            if (value.endsWith("Z") || value.endsWith("z")) {
                return Instant.parse(value.toUpperCase());
            }
            if (value.indexOf('T') > 0) {
                if (hasOffset(value)) {
                    return OffsetDateTime.parse(value).toInstant();
                }
                return LocalDateTime.parse(value).toInstant(ZoneOffset.UTC);
            }
            return LocalDateTime.parse(value, SPACE_SEPARATED).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Unparseable timestamp: " + text, e);
        }
    }

    public static boolean isMidnightUtc(Instant instant) {
        return instant.atOffset(ZoneOffset.UTC).toLocalTime().toNanoOfDay() == 0;
    }

    public static LocalDate utcDate(Instant instant) {
        return instant.atOffset(ZoneOffset.UTC).toLocalDate();
    }

    public static Instant startOfUtcDay(Instant instant) {
        return utcDate(instant).atStartOfDay(ZoneOffset.UTC).toInstant();
    }

    /** Last representable nanosecond of the UTC day containing {@code instant}. */
    public static Instant endOfUtcDay(Instant instant) {
        return utcDate(instant).plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant().minusNanos(1);
    }

    private static boolean hasOffset(String value) {
        int t = value.indexOf('T');
        return value.indexOf('+', t) > 0 || value.indexOf('-', t) > 0;
    }
}
