package com.barvault.core.model;

/**
 * Full identity of a bar series: instrument, spec and aggregation source.
 * Its string form ("AAPL.NASDAQ-1-MINUTE-LAST-EXTERNAL") names the partition directory.
 */
public record BarType(InstrumentId instrumentId, BarSpec spec, AggregationSource source) {

    public BarType {
        if (instrumentId == null || spec == null || source == null) {
            throw new IllegalArgumentException("instrumentId, spec and source are required");
        }
    }

    public static BarType external(InstrumentId instrumentId, BarSpec spec) {
        return new BarType(instrumentId, spec, AggregationSource.EXTERNAL);
    }

    /**
     * Parse "{instrumentId}-{step}-{aggregation}-{priceType}-{source}".
     * Splits from the right, so symbols containing '-' are handled.
     *
     * @throws IllegalArgumentException if the text is malformed
     */
    public static BarType parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("bar type is null");
        }
        String rest = value;
        String[] tail = new String[4];
        for (int i = 3; i >= 0; i--) {
            int dash = rest.lastIndexOf('-');
            if (dash <= 0) {
                throw new IllegalArgumentException("Invalid bar type: " + value);
            }
            tail[i] = rest.substring(dash + 1);
            rest = rest.substring(0, dash);
        }
        InstrumentId instrumentId = InstrumentId.parse(rest);
        BarSpec spec = BarSpec.parse(tail[0] + "-" + tail[1] + "-" + tail[2]);
        AggregationSource source;
        try {
            source = AggregationSource.valueOf(tail[3]);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid aggregation source in bar type: " + value, e);
        }
        return new BarType(instrumentId, spec, source);
    }

    public SeriesKey seriesKey() {
        return new SeriesKey(instrumentId, spec);
    }

    @Override
    public String toString() {
        return instrumentId + "-" + spec + "-" + source;
    }
}
