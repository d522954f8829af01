package com.barvault.core.model;

/**
 * Identifies one cached bar series: an instrument at one bar spec.
 */
public record SeriesKey(InstrumentId instrumentId, BarSpec barSpec) {

    public SeriesKey {
        if (instrumentId == null || barSpec == null) {
            throw new IllegalArgumentException("instrumentId and barSpec are required");
        }
    }

    public static SeriesKey of(String instrumentId, String barSpec) {
        return new SeriesKey(InstrumentId.parse(instrumentId), BarSpec.parse(barSpec));
    }

    @Override
    public String toString() {
        return instrumentId + "-" + barSpec;
    }
}
