package com.barvault.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Trading venue code (e.g. "NASDAQ", "SIM").
 */
public record Venue(String code) {

    /** Generic simulation venue used when nothing more specific is known. */
    public static final Venue SIM = new Venue("SIM");

    public Venue {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("venue code is required");
        }
        code = code.trim().toUpperCase();
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Venue of(String code) {
        return new Venue(code);
    }

    public boolean isSimulation() {
        return SIM.equals(this);
    }

    @JsonValue
    @Override
    public String toString() {
        return code;
    }
}
