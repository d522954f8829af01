package com.barvault.dataservice.store;

import com.barvault.core.model.BarType;

import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Partition directory and file names.
 *
 * Directory: {instrumentId}-{barSpec}-{source}, URL-encoded (so "EUR/USD.SIM" is safe).
 * File: {start}Z_{end}Z.bvc with timestamps as yyyy-MM-dd'T'HH-mm-ss-nnnnnnnnn (UTC).
 */
public final class PartitionNaming {

    public static final String EXTENSION = ".bvc";
    public static final String TEMP_PREFIX = ".tmp-";

    private static final DateTimeFormatter TIMESTAMP =
        DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH-mm-ss-nnnnnnnnn");

    private static final String TS_REGEX = "\\d{4}-\\d{2}-\\d{2}T\\d{2}-\\d{2}-\\d{2}-\\d{9}";
    private static final Pattern FILE_NAME =
        Pattern.compile("^(" + TS_REGEX + ")Z_(" + TS_REGEX + ")Z" + Pattern.quote(EXTENSION) + "$");

    public record FileRange(Instant start, Instant end) {

        public boolean intersects(Instant from, Instant to) {
            return !(end.isBefore(from) || start.isAfter(to));
        }
    }

    private PartitionNaming() {
    }

    public static String directoryName(BarType barType) {
        return URLEncoder.encode(barType.toString(), StandardCharsets.UTF_8);
    }

    /**
     * @throws IllegalArgumentException if the name is not a bar type
     */
    public static BarType parseDirectoryName(String name) {
        return BarType.parse(URLDecoder.decode(name, StandardCharsets.UTF_8));
    }

    public static String fileName(Instant start, Instant end) {
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("start " + start + " is after end " + end);
        }
        return formatTimestamp(start) + "Z_" + formatTimestamp(end) + "Z" + EXTENSION;
    }

    /**
     * @throws IllegalArgumentException if the name does not follow the partition pattern
     */
    public static FileRange parseFileName(String name) {
        Matcher m = FILE_NAME.matcher(name);
        if (!m.matches()) {
            throw new IllegalArgumentException("Not a partition file name: " + name);
        }
        Instant start = parseTimestamp(m.group(1));
        Instant end = parseTimestamp(m.group(2));
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("Partition start after end: " + name);
        }
        return new FileRange(start, end);
    }

    public static boolean isPartitionFile(String name) {
        return name.endsWith(EXTENSION) && !name.startsWith(".");
    }

    static String formatTimestamp(Instant instant) {
        return TIMESTAMP.format(LocalDateTime.ofInstant(instant, ZoneOffset.UTC));
    }

    static Instant parseTimestamp(String text) {
        try {
            return LocalDateTime.parse(text, TIMESTAMP).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid partition timestamp: " + text, e);
        }
    }
}
