package com.barvault.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Identifies a tradable instrument as a symbol/venue pair, written "SYMBOL.VENUE".
 * The venue is everything after the last dot, so symbols may contain dots or slashes
 * (e.g. "BRK.B.NYSE", "EUR/USD.SIM").
 */
public record InstrumentId(String symbol, String venue) {

    public InstrumentId {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("symbol is required");
        }
        if (venue == null || venue.isBlank()) {
            throw new IllegalArgumentException("venue is required");
        }
    }

    /**
     * Parse "SYMBOL.VENUE".
     *
     * @throws IllegalArgumentException if there is no venue part
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static InstrumentId parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("instrument id is null");
        }
        String trimmed = value.trim();
        int dot = trimmed.lastIndexOf('.');
        if (dot <= 0 || dot == trimmed.length() - 1) {
            throw new IllegalArgumentException("Invalid instrument id (expected SYMBOL.VENUE): " + value);
        }
        return new InstrumentId(trimmed.substring(0, dot), trimmed.substring(dot + 1));
    }

    public Venue venueValue() {
        return new Venue(venue);
    }

    @JsonValue
    @Override
    public String toString() {
        return symbol + "." + venue;
    }
}
