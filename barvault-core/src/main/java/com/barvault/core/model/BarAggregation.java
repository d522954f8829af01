package com.barvault.core.model;

import java.time.Duration;

/**
 * Time unit of a bar specification.
 */
public enum BarAggregation {
    SECOND(Duration.ofSeconds(1), false),
    MINUTE(Duration.ofMinutes(1), false),
    HOUR(Duration.ofHours(1), false),
    DAY(Duration.ofDays(1), true),
    WEEK(Duration.ofDays(7), true),
    MONTH(Duration.ofDays(30), true);

    private final Duration unit;
    private final boolean calendarGranularity;

    BarAggregation(Duration unit, boolean calendarGranularity) {
        this.unit = unit;
        this.calendarGranularity = calendarGranularity;
    }

    /** Approximate length of one unit (MONTH is taken as 30 days). */
    public Duration unit() {
        return unit;
    }

    /**
     * True for day-level and coarser aggregations, whose cache boundaries are
     * compared on calendar dates rather than full timestamps.
     */
    public boolean isCalendarGranularity() {
        return calendarGranularity;
    }
}
