package com.barvault.core.model;

import com.barvault.core.time.Timestamps;

import java.time.Instant;

/**
 * Cached time range for one (instrument, bar spec) series.
 * Always replaced as a whole, never updated in place.
 */
public record TimeRangeAvailability(
    InstrumentId instrumentId,
    BarSpec barSpec,
    Instant start,
    Instant end,
    int fileCount,
    long estimatedRowCount,
    Instant lastUpdated
) {

    public TimeRangeAvailability {
        if (instrumentId == null || barSpec == null) {
            throw new IllegalArgumentException("instrumentId and barSpec are required");
        }
        if (start == null || end == null) {
            throw new IllegalArgumentException("start and end are required");
        }
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("start " + start + " is after end " + end);
        }
        if (fileCount < 1) {
            throw new IllegalArgumentException("fileCount must be >= 1, got " + fileCount);
        }
        if (estimatedRowCount < 0) {
            throw new IllegalArgumentException("estimatedRowCount must be >= 0");
        }
        if (lastUpdated == null) {
            lastUpdated = Instant.now();
        }
    }

    public SeriesKey key() {
        return new SeriesKey(instrumentId, barSpec);
    }

    /**
     * Whether the cached range fully contains [requestStart, requestEnd].
     * Day and coarser specs compare UTC calendar dates only, because date-only
     * input parses to midnight and would never reach an end-of-day boundary.
     */
    public boolean coversRange(Instant requestStart, Instant requestEnd) {
        if (barSpec.isCalendarGranularity()) {
            return !Timestamps.utcDate(start).isAfter(Timestamps.utcDate(requestStart))
                && !Timestamps.utcDate(end).isBefore(Timestamps.utcDate(requestEnd));
        }
        return !start.isAfter(requestStart) && !end.isBefore(requestEnd);
    }

    /**
     * Whether the cached range shares at least one instant with [requestStart, requestEnd].
     */
    public boolean overlapsRange(Instant requestStart, Instant requestEnd) {
        return !(end.isBefore(requestStart) || start.isAfter(requestEnd));
    }
}
