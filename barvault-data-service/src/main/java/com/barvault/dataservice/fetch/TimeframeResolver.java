package com.barvault.dataservice.fetch;

import com.barvault.core.model.BarSpec;
import com.barvault.core.time.Timestamps;

import java.time.Instant;
import java.util.Optional;

/**
 * Picks the bar spec for a request. An explicit timeframe always wins; otherwise
 * a start at midnight UTC (date-only input) means day bars and a start with a
 * time of day means minute bars. The end bound does not take part.
 */
public class TimeframeResolver {

    private final BarSpec dayLevel;
    private final BarSpec intraday;

    public TimeframeResolver() {
        this(BarSpec.ONE_DAY_LAST, BarSpec.ONE_MINUTE_LAST);
    }

    public TimeframeResolver(BarSpec dayLevel, BarSpec intraday) {
        this.dayLevel = dayLevel;
        this.intraday = intraday;
    }

    /**
     * @throws IllegalArgumentException if the explicit timeframe is not a valid spec
     */
    public BarSpec resolve(Optional<String> explicit, Instant start, Instant end) {
        if (explicit.isPresent() && !explicit.get().isBlank()) {
            return BarSpec.parse(explicit.get());
        }
        if (Timestamps.isMidnightUtc(start)) {
            return dayLevel;
        }
        return intraday;
    }

    /**
     * Same as {@link #resolve(Optional, Instant, Instant)} for text bounds such as
     * "2024-01-02" or "2024-01-02 09:30:00".
     */
    public BarSpec resolve(Optional<String> explicit, String start, String end) {
        return resolve(explicit, Timestamps.parse(start), Timestamps.parse(end));
    }
}
