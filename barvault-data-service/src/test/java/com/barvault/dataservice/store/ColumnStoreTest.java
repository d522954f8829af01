package com.barvault.dataservice.store;

import com.barvault.core.model.AggregationSource;
import com.barvault.core.model.Bar;
import com.barvault.core.model.BarSpec;
import com.barvault.core.model.BarType;
import com.barvault.core.model.InstrumentDescriptor;
import com.barvault.core.model.InstrumentId;
import com.barvault.dataservice.exception.CatalogCorruptionException;
import com.barvault.dataservice.testing.TestBars;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class ColumnStoreTest {

    private static final InstrumentId AAPL = InstrumentId.parse("AAPL.NASDAQ");
    private static final BarType AAPL_1M = BarType.external(AAPL, BarSpec.ONE_MINUTE_LAST);
    private static final Instant OPEN = Instant.parse("2024-01-02T09:30:00Z");
    private static final Instant HOUR_LATER = Instant.parse("2024-01-02T10:30:00Z");

    @TempDir
    Path tempDir;

    private ColumnStore store;

    @BeforeEach
    void setUp() {
        store = new ColumnStore(tempDir);
    }

    @Nested
    @DisplayName("Write and query")
    class WriteQueryTests {

        @Test
        @DisplayName("Should return written bars in range, sorted")
        void roundTripsBars() throws Exception {
            // Given
            List<Bar> bars = TestBars.between(AAPL_1M, OPEN, HOUR_LATER);

            // When
            PartitionMeta meta = store.write(bars, OPEN, HOUR_LATER, "test");
            List<Bar> read = store.query(AAPL, BarSpec.ONE_MINUTE_LAST, OPEN, HOUR_LATER);

            // Then
            assertEquals(60, meta.rowCount());
            assertEquals(OPEN, meta.start());
            assertEquals(HOUR_LATER, meta.end());
            assertEquals(bars, read);
        }

        @Test
        @DisplayName("Should trim the query to the requested range")
        void queryTrimsRange() throws Exception {
            store.write(TestBars.between(AAPL_1M, OPEN, HOUR_LATER), OPEN, HOUR_LATER, "test");

            List<Bar> read = store.query(AAPL, BarSpec.ONE_MINUTE_LAST,
                OPEN.plus(Duration.ofMinutes(10)), OPEN.plus(Duration.ofMinutes(19)));

            assertEquals(10, read.size());
            assertEquals(OPEN.plus(Duration.ofMinutes(10)), read.get(0).eventTime());
        }

        @Test
        @DisplayName("Should return an empty list when nothing is stored")
        void emptyWhenNothingStored() throws Exception {
            assertTrue(store.query(AAPL, BarSpec.ONE_MINUTE_LAST, OPEN, HOUR_LATER).isEmpty());
        }

        @Test
        @DisplayName("Should reject bars outside the covered window")
        void rejectsBarsOutsideWindow() {
            List<Bar> bars = TestBars.series(AAPL_1M, OPEN, 5);

            assertThrows(IllegalArgumentException.class,
                () -> store.write(bars, OPEN.plus(Duration.ofMinutes(1)), HOUR_LATER, "test"));
        }

        @Test
        @DisplayName("Should reject an empty batch")
        void rejectsEmptyBatch() {
            assertThrows(IllegalArgumentException.class, () -> store.write(List.of(), "test"));
        }

        @Test
        @DisplayName("Should leave no temp files behind")
        void noTempFiles() throws Exception {
            store.write(TestBars.series(AAPL_1M, OPEN, 3), "test");

            try (Stream<Path> files = Files.walk(store.getBarDirectory())) {
                assertTrue(files.noneMatch(p -> p.getFileName().toString().startsWith(PartitionNaming.TEMP_PREFIX)));
            }
        }
    }

    @Nested
    @DisplayName("Overlapping partitions")
    class OverlapTests {

        @Test
        @DisplayName("Should union overlapping writes with the newest file winning")
        void newestWins() throws Exception {
            // Given: two overlapping batches, the second with different closes
            store.write(TestBars.series(AAPL_1M, OPEN, 10), "first");
            Instant laterStart = OPEN.plus(Duration.ofMinutes(5));
            List<Bar> second = List.of(
                TestBars.bar(AAPL_1M, laterStart, "200.00"),
                TestBars.bar(AAPL_1M, laterStart.plus(Duration.ofMinutes(10)), "201.00"));
            store.write(second, "second");

            // When
            List<Bar> read = store.query(AAPL, BarSpec.ONE_MINUTE_LAST, OPEN, HOUR_LATER);

            // Then: 10 from the first batch plus one new time, the shared time from the second
            assertEquals(11, read.size());
            assertEquals(new BigDecimal("200.00"), read.get(5).close());
            assertEquals(new BigDecimal("100.04"), read.get(4).close());
        }

        @Test
        @DisplayName("Should be idempotent when the same window is written twice")
        void sameWindowTwice() throws Exception {
            List<Bar> bars = TestBars.between(AAPL_1M, OPEN, HOUR_LATER);
            store.write(bars, OPEN, HOUR_LATER, "a");
            store.write(bars, OPEN, HOUR_LATER, "b");

            assertEquals(60, store.query(AAPL, BarSpec.ONE_MINUTE_LAST, OPEN, HOUR_LATER).size());
            assertEquals(1, store.listPartitions(AAPL_1M).size());
        }

        @Test
        @DisplayName("Should merge EXTERNAL and INTERNAL sources on read")
        void mergesSources() throws Exception {
            BarType internal = new BarType(AAPL, BarSpec.ONE_MINUTE_LAST, AggregationSource.INTERNAL);
            store.write(TestBars.series(AAPL_1M, OPEN, 2), "ext");
            store.write(TestBars.series(internal, OPEN.plus(Duration.ofMinutes(2)), 2), "int");

            assertEquals(4, store.query(AAPL, BarSpec.ONE_MINUTE_LAST, OPEN, HOUR_LATER).size());
        }

        @Test
        @DisplayName("Should delete only partitions overlapping the range")
        void deletesOverlapping() throws Exception {
            store.write(TestBars.series(AAPL_1M, OPEN, 5), "a");
            store.write(TestBars.series(AAPL_1M, HOUR_LATER, 5), "b");

            int deleted = store.deletePartitions(AAPL_1M, OPEN, OPEN.plus(Duration.ofMinutes(2)));

            assertEquals(1, deleted);
            List<PartitionMeta> left = store.listPartitions(AAPL_1M);
            assertEquals(1, left.size());
            assertEquals(HOUR_LATER, left.get(0).start());
        }
    }

    @Nested
    @DisplayName("Scanning and corruption")
    class ScanTests {

        @Test
        @DisplayName("Should scan header metadata without reading all rows")
        void scansPartitions() throws Exception {
            store.write(TestBars.series(AAPL_1M, OPEN, 7), "a");

            List<PartitionMeta> scanned = store.scanPartitions();

            assertEquals(1, scanned.size());
            assertEquals(AAPL_1M, scanned.get(0).barType());
            assertEquals(7, scanned.get(0).rowCount());
            assertTrue(scanned.get(0).sizeBytes() > 0);
        }

        @Test
        @DisplayName("Should skip files with unparsable names during scan")
        void skipsBadNames() throws Exception {
            store.write(TestBars.series(AAPL_1M, OPEN, 3), "a");
            Path dir = store.getBarDirectory().resolve(PartitionNaming.directoryName(AAPL_1M));
            Files.write(dir.resolve("garbage.bvc"), new byte[]{1, 2, 3});
            Files.createDirectories(store.getBarDirectory().resolve("not-a-bar-type"));

            assertEquals(1, store.scanPartitions().size());
        }

        @Test
        @DisplayName("Should skip undecodable files during scan but fail queries that touch them")
        void corruptContent() throws Exception {
            PartitionMeta meta = store.write(TestBars.series(AAPL_1M, OPEN, 3), "a");
            Files.write(meta.file(), new byte[]{0x01});

            assertTrue(store.scanPartitions().isEmpty());
            CatalogCorruptionException e = assertThrows(CatalogCorruptionException.class,
                () -> store.query(AAPL, BarSpec.ONE_MINUTE_LAST, OPEN, HOUR_LATER));
            assertEquals(meta.file(), e.getFile());
        }
    }

    @Nested
    @DisplayName("Descriptors")
    class DescriptorTests {

        @Test
        @DisplayName("Should persist and reload a descriptor")
        void roundTripsDescriptor() throws Exception {
            InstrumentDescriptor descriptor = InstrumentDescriptor.equity(AAPL, "USD");

            store.write(descriptor);
            Optional<InstrumentDescriptor> loaded = store.loadDescriptor(AAPL);

            assertTrue(loaded.isPresent());
            assertEquals(AAPL, loaded.get().instrumentId());
            assertEquals(0, new BigDecimal("0.01").compareTo(loaded.get().tickSize()));
        }

        @Test
        @DisplayName("Should return empty for an unknown instrument")
        void unknownDescriptor() throws Exception {
            assertTrue(store.loadDescriptor(InstrumentId.parse("MSFT.NASDAQ")).isEmpty());
        }
    }
}
