package com.barvault.dataservice.exception;

import java.time.Instant;

/**
 * Requested bars are not cached and could not be obtained from the provider.
 */
public class DataNotFoundException extends CatalogException {

    private final String instrumentId;
    private final Instant start;
    private final Instant end;

    public DataNotFoundException(String instrumentId, Instant start, Instant end) {
        this(instrumentId, start, end, null);
    }

    public DataNotFoundException(String instrumentId, Instant start, Instant end, String hint) {
        super(buildMessage(instrumentId, start, end, hint));
        this.instrumentId = instrumentId;
        this.start = start;
        this.end = end;
    }

    private static String buildMessage(String instrumentId, Instant start, Instant end, String hint) {
        String message = "Data not found: " + instrumentId + " from " + start + " to " + end;
        return hint == null ? message : message + "\n" + hint;
    }

    public String getInstrumentId() {
        return instrumentId;
    }

    public Instant getStart() {
        return start;
    }

    public Instant getEnd() {
        return end;
    }
}
