package com.barvault.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class TimeRangeAvailabilityTest {

    private static final InstrumentId AAPL = InstrumentId.parse("AAPL.NASDAQ");

    private static TimeRangeAvailability availability(BarSpec spec, String start, String end) {
        return new TimeRangeAvailability(AAPL, spec, Instant.parse(start), Instant.parse(end), 1, 10, null);
    }

    @Nested
    @DisplayName("Day-level coverage")
    class DayCoverageTests {

        @Test
        @DisplayName("Identical date range is covered even when the cached end is late in the day")
        void identicalRangeCovered() {
            // Given
            TimeRangeAvailability cached = availability(BarSpec.ONE_DAY_LAST,
                "2024-01-19T00:00:00Z", "2024-02-28T23:59:59.999999999Z");

            // When / Then
            assertTrue(cached.coversRange(Instant.parse("2024-01-19T00:00:00Z"), Instant.parse("2024-02-28T00:00:00Z")));
        }

        @Test
        @DisplayName("Request end at a later time on the cached end date is covered")
        void laterTimeSameDateCovered() {
            TimeRangeAvailability cached = availability(BarSpec.ONE_DAY_LAST,
                "2024-01-19T00:00:00Z", "2024-02-28T00:00:00Z");

            assertTrue(cached.coversRange(Instant.parse("2024-01-19T00:00:00Z"), Instant.parse("2024-02-28T21:00:00Z")));
        }

        @Test
        @DisplayName("Request past the cached end date is not covered")
        void pastEndNotCovered() {
            TimeRangeAvailability cached = availability(BarSpec.ONE_DAY_LAST,
                "2024-01-19T00:00:00Z", "2024-02-28T00:00:00Z");

            assertFalse(cached.coversRange(Instant.parse("2024-01-19T00:00:00Z"), Instant.parse("2024-02-29T00:00:00Z")));
        }

        @Test
        @DisplayName("Week specs also compare dates")
        void weekComparesDates() {
            TimeRangeAvailability cached = availability(BarSpec.parse("1-WEEK-LAST"),
                "2024-01-01T00:00:00Z", "2024-03-01T00:00:00Z");

            assertTrue(cached.coversRange(Instant.parse("2024-01-01T12:00:00Z"), Instant.parse("2024-03-01T23:00:00Z")));
        }
    }

    @Nested
    @DisplayName("Sub-day coverage")
    class IntradayCoverageTests {

        @Test
        @DisplayName("Minute specs compare full timestamps")
        void minuteComparesTimestamps() {
            TimeRangeAvailability cached = availability(BarSpec.ONE_MINUTE_LAST,
                "2024-01-02T09:30:00Z", "2024-01-02T10:30:00Z");

            assertTrue(cached.coversRange(Instant.parse("2024-01-02T09:30:00Z"), Instant.parse("2024-01-02T10:30:00Z")));
            assertFalse(cached.coversRange(Instant.parse("2024-01-02T09:30:00Z"), Instant.parse("2024-01-02T10:31:00Z")));
            assertFalse(cached.coversRange(Instant.parse("2024-01-02T09:29:00Z"), Instant.parse("2024-01-02T10:00:00Z")));
        }
    }

    @Test
    @DisplayName("Overlap is inclusive at both ends")
    void overlapInclusive() {
        TimeRangeAvailability cached = availability(BarSpec.ONE_MINUTE_LAST,
            "2024-01-02T09:30:00Z", "2024-01-02T10:30:00Z");

        assertTrue(cached.overlapsRange(Instant.parse("2024-01-02T10:30:00Z"), Instant.parse("2024-01-02T11:00:00Z")));
        assertTrue(cached.overlapsRange(Instant.parse("2024-01-02T09:00:00Z"), Instant.parse("2024-01-02T09:30:00Z")));
        assertFalse(cached.overlapsRange(Instant.parse("2024-01-02T10:31:00Z"), Instant.parse("2024-01-02T11:00:00Z")));
    }

    @Test
    @DisplayName("Start after end is rejected")
    void rejectsInvertedRange() {
        assertThrows(IllegalArgumentException.class, () -> availability(BarSpec.ONE_MINUTE_LAST,
            "2024-01-03T00:00:00Z", "2024-01-02T00:00:00Z"));
    }
}
