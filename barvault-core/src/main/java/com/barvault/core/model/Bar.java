package com.barvault.core.model;

import com.barvault.core.time.Timestamps;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * One OHLCV observation. Times are UTC epoch nanoseconds.
 */
public record Bar(
    BarType barType,
    BigDecimal open,
    BigDecimal high,
    BigDecimal low,
    BigDecimal close,
    long volume,
    long eventTimeNs,
    long ingestTimeNs
) {

    public Bar {
        if (barType == null) {
            throw new IllegalArgumentException("barType is required");
        }
        if (open == null || high == null || low == null || close == null) {
            throw new IllegalArgumentException("prices are required");
        }
        if (volume < 0) {
            throw new IllegalArgumentException("volume must be >= 0, got " + volume);
        }
        if (low.compareTo(high) > 0) {
            throw new IllegalArgumentException("low (" + low + ") must be <= high (" + high + ")");
        }
        if (open.compareTo(low) < 0 || open.compareTo(high) > 0) {
            throw new IllegalArgumentException("open (" + open + ") outside [" + low + ", " + high + "]");
        }
        if (close.compareTo(low) < 0 || close.compareTo(high) > 0) {
            throw new IllegalArgumentException("close (" + close + ") outside [" + low + ", " + high + "]");
        }
    }

    public Instant eventTime() {
        return Timestamps.fromEpochNanos(eventTimeNs);
    }

    public Instant ingestTime() {
        return Timestamps.fromEpochNanos(ingestTimeNs);
    }

    /**
     * Check that a series belongs to one bar type and is strictly increasing in event time.
     *
     * @throws IllegalArgumentException on the first violation
     */
    public static void validateSeries(List<Bar> bars) {
        Bar previous = null;
        for (Bar bar : bars) {
            if (previous != null) {
                if (!previous.barType().equals(bar.barType())) {
                    throw new IllegalArgumentException("Mixed bar types in series: "
                        + previous.barType() + " and " + bar.barType());
                }
                if (bar.eventTimeNs() <= previous.eventTimeNs()) {
                    throw new IllegalArgumentException("Event times not strictly increasing at "
                        + bar.eventTime() + " (previous " + previous.eventTime() + ")");
                }
            }
            previous = bar;
        }
    }
}
