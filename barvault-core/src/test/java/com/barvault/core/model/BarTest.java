package com.barvault.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BarTest {

    private static final BarType TYPE = BarType.external(InstrumentId.parse("AAPL.NASDAQ"), BarSpec.ONE_MINUTE_LAST);

    private static Bar bar(String o, String h, String l, String c, long volume, long ts) {
        return new Bar(TYPE, new BigDecimal(o), new BigDecimal(h), new BigDecimal(l), new BigDecimal(c),
            volume, ts, ts);
    }

    @Nested
    @DisplayName("Invariants")
    class InvariantTests {

        @Test
        @DisplayName("Should accept a well-formed bar")
        void acceptsValidBar() {
            Bar bar = bar("100.00", "101.50", "99.50", "101.00", 1200, 1_000L);
            assertEquals(1200, bar.volume());
        }

        @Test
        @DisplayName("Should reject low above high")
        void rejectsInvertedRange() {
            assertThrows(IllegalArgumentException.class, () -> bar("100", "99", "101", "100", 1, 0));
        }

        @Test
        @DisplayName("Should reject open or close outside the range")
        void rejectsOutsideRange() {
            assertThrows(IllegalArgumentException.class, () -> bar("102", "101", "99", "100", 1, 0));
            assertThrows(IllegalArgumentException.class, () -> bar("100", "101", "99", "98", 1, 0));
        }

        @Test
        @DisplayName("Should reject negative volume")
        void rejectsNegativeVolume() {
            assertThrows(IllegalArgumentException.class, () -> bar("100", "101", "99", "100", -1, 0));
        }
    }

    @Nested
    @DisplayName("Series validation")
    class SeriesTests {

        @Test
        @DisplayName("Should accept strictly increasing event times")
        void acceptsIncreasing() {
            assertDoesNotThrow(() -> Bar.validateSeries(List.of(
                bar("1", "1", "1", "1", 0, 1), bar("1", "1", "1", "1", 0, 2))));
        }

        @Test
        @DisplayName("Should reject duplicate event times")
        void rejectsDuplicates() {
            assertThrows(IllegalArgumentException.class, () -> Bar.validateSeries(List.of(
                bar("1", "1", "1", "1", 0, 5), bar("1", "1", "1", "1", 0, 5))));
        }

        @Test
        @DisplayName("Should reject mixed bar types")
        void rejectsMixedTypes() {
            BarType other = BarType.external(InstrumentId.parse("MSFT.NASDAQ"), BarSpec.ONE_MINUTE_LAST);
            Bar a = bar("1", "1", "1", "1", 0, 1);
            Bar b = new Bar(other, BigDecimal.ONE, BigDecimal.ONE, BigDecimal.ONE, BigDecimal.ONE, 0, 2, 2);
            assertThrows(IllegalArgumentException.class, () -> Bar.validateSeries(List.of(a, b)));
        }
    }
}
