package com.barvault.core.time;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class TimestampsTest {

    @Test
    @DisplayName("Should parse the accepted input forms as UTC")
    void parsesInputForms() {
        assertEquals(Instant.parse("2024-01-02T00:00:00Z"), Timestamps.parse("2024-01-02"));
        assertEquals(Instant.parse("2024-01-02T09:30:00Z"), Timestamps.parse("2024-01-02 09:30:00"));
        assertEquals(Instant.parse("2024-01-02T09:30:00Z"), Timestamps.parse("2024-01-02 09:30"));
        assertEquals(Instant.parse("2024-01-02T09:30:00Z"), Timestamps.parse("2024-01-02T09:30:00"));
        assertEquals(Instant.parse("2024-01-02T09:30:00Z"), Timestamps.parse("2024-01-02T09:30:00Z"));
        assertEquals(Instant.parse("2024-01-02T14:30:00Z"), Timestamps.parse("2024-01-02T09:30:00-05:00"));
    }

    @Test
    @DisplayName("Should reject unparseable input")
    void rejectsGarbage() {
        assertThrows(IllegalArgumentException.class, () -> Timestamps.parse("yesterday"));
        assertThrows(IllegalArgumentException.class, () -> Timestamps.parse(""));
    }

    @Test
    @DisplayName("Epoch nanos round trip keeps sub-second precision")
    void epochNanos() {
        Instant instant = Instant.parse("2024-01-02T09:30:00.123456789Z");
        long nanos = Timestamps.toEpochNanos(instant);

        assertEquals(1_704_187_800_123_456_789L, nanos);
        assertEquals(instant, Timestamps.fromEpochNanos(nanos));
    }

    @Test
    @DisplayName("Midnight detection")
    void midnight() {
        assertTrue(Timestamps.isMidnightUtc(Instant.parse("2024-01-02T00:00:00Z")));
        assertFalse(Timestamps.isMidnightUtc(Instant.parse("2024-01-02T00:00:00.000000001Z")));
    }

    @Test
    @DisplayName("UTC day bounds")
    void dayBounds() {
        Instant afternoon = Instant.parse("2024-02-28T16:00:00Z");

        assertEquals(Instant.parse("2024-02-28T00:00:00Z"), Timestamps.startOfUtcDay(afternoon));
        assertEquals(Instant.parse("2024-02-28T23:59:59.999999999Z"), Timestamps.endOfUtcDay(afternoon));
        assertEquals(Instant.parse("2024-02-28T23:59:59.999999999Z"),
            Timestamps.endOfUtcDay(Instant.parse("2024-02-28T00:00:00Z")));
    }
}
