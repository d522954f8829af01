package com.barvault.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;

/**
 * Bar granularity and price type, written "STEP-AGGREGATION-PRICETYPE" (e.g. "1-MINUTE-LAST").
 */
public record BarSpec(int step, BarAggregation aggregation, PriceType priceType) {

    public static final BarSpec ONE_MINUTE_LAST = new BarSpec(1, BarAggregation.MINUTE, PriceType.LAST);
    public static final BarSpec ONE_DAY_LAST = new BarSpec(1, BarAggregation.DAY, PriceType.LAST);

    // Short forms accepted from user input
    private static final Map<String, BarSpec> ALIASES = Map.ofEntries(
        Map.entry("1m", ONE_MINUTE_LAST),
        Map.entry("5m", new BarSpec(5, BarAggregation.MINUTE, PriceType.LAST)),
        Map.entry("15m", new BarSpec(15, BarAggregation.MINUTE, PriceType.LAST)),
        Map.entry("30m", new BarSpec(30, BarAggregation.MINUTE, PriceType.LAST)),
        Map.entry("1h", new BarSpec(1, BarAggregation.HOUR, PriceType.LAST)),
        Map.entry("4h", new BarSpec(4, BarAggregation.HOUR, PriceType.LAST)),
        Map.entry("1d", ONE_DAY_LAST),
        Map.entry("1w", new BarSpec(1, BarAggregation.WEEK, PriceType.LAST)),
        Map.entry("daily", ONE_DAY_LAST),
        Map.entry("weekly", new BarSpec(1, BarAggregation.WEEK, PriceType.LAST))
    );

    public BarSpec {
        if (step <= 0) {
            throw new IllegalArgumentException("step must be positive: " + step);
        }
        if (aggregation == null || priceType == null) {
            throw new IllegalArgumentException("aggregation and priceType are required");
        }
    }

    /**
     * Parse a canonical spec ("1-MINUTE-LAST"), a spec without price type ("1-MINUTE",
     * LAST is implied) or a short alias ("1m", "1h", "1d", "DAILY").
     *
     * @throws IllegalArgumentException if the text is not a recognised spec
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static BarSpec parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("bar spec is empty");
        }
        String trimmed = value.trim();
        BarSpec alias = ALIASES.get(trimmed.toLowerCase(Locale.ROOT));
        if (alias != null) {
            return alias;
        }

        String[] parts = trimmed.toUpperCase(Locale.ROOT).split("-");
        if (parts.length != 2 && parts.length != 3) {
            throw new IllegalArgumentException("Invalid bar spec: " + value);
        }
        try {
            int step = Integer.parseInt(parts[0]);
            BarAggregation aggregation = BarAggregation.valueOf(parts[1]);
            PriceType priceType = parts.length == 3 ? PriceType.valueOf(parts[2]) : PriceType.LAST;
            return new BarSpec(step, aggregation, priceType);
        } catch (IllegalArgumentException e) {
            // NumberFormatException is an IllegalArgumentException too
            throw new IllegalArgumentException("Invalid bar spec: " + value, e);
        }
    }

    /** Length of one bar. */
    public Duration interval() {
        return aggregation.unit().multipliedBy(step);
    }

    public boolean isCalendarGranularity() {
        return aggregation.isCalendarGranularity();
    }

    @JsonValue
    @Override
    public String toString() {
        return step + "-" + aggregation + "-" + priceType;
    }
}
