package com.barvault.dataservice.fetchlog;

import com.barvault.core.model.BarSpec;
import com.barvault.core.model.InstrumentId;
import com.barvault.dataservice.fetch.FetchRequest;
import com.barvault.dataservice.fetch.FetchStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class FetchLogDaoTest {

    private static final Instant START = Instant.parse("2024-01-02T09:30:00Z");
    private static final Instant END = Instant.parse("2024-01-02T10:30:00Z");

    @TempDir
    Path tempDir;

    private FetchLogConnection connection;
    private FetchLogDao dao;

    @BeforeEach
    void setUp() throws Exception {
        connection = new FetchLogConnection(tempDir.resolve("data").resolve("fetch-log.db"));
        connection.initializeSchema();
        dao = new FetchLogDao(connection);
    }

    @AfterEach
    void tearDown() {
        connection.close();
    }

    private static FetchRequest request(String instrumentId, String createdAt) {
        return new FetchRequest(InstrumentId.parse(instrumentId), BarSpec.ONE_MINUTE_LAST, START, END, 3,
            Clock.fixed(Instant.parse(createdAt), ZoneOffset.UTC));
    }

    @Nested
    @DisplayName("Recording")
    class RecordingTests {

        @Test
        @DisplayName("Should create the database file and its parent directories")
        void createsDatabase() {
            dao.record(request("AAPL.NASDAQ", "2024-01-02T12:00:00Z"));

            assertTrue(Files.exists(connection.getDbFile()));
        }

        @Test
        @DisplayName("Should keep one row per request, updated on each transition")
        void upsertsTransitions() throws Exception {
            // Given
            FetchRequest r = request("AAPL.NASDAQ", "2024-01-02T12:00:00Z");
            dao.record(r);
            r.start();
            dao.record(r);
            r.fail("HTTP 503");
            dao.record(r);
            r.retry();
            r.start();
            r.complete();

            // When
            dao.record(r);

            // Then
            FetchRequest.Snapshot stored = dao.get(r.getRequestId()).orElseThrow();
            assertEquals(FetchStatus.COMPLETED, stored.status());
            assertEquals(1, stored.retryCount());
            assertEquals(3, stored.maxRetries());
            assertNull(stored.error());
            assertEquals(START, stored.start());
            assertEquals(END, stored.end());
            assertEquals(Instant.parse("2024-01-02T12:00:00Z"), stored.completedAt());
            assertEquals(1, dao.recent(10).size());
        }

        @Test
        @DisplayName("Should keep the failure reason of a failed request")
        void keepsError() throws Exception {
            FetchRequest r = request("AAPL.NASDAQ", "2024-01-02T12:00:00Z");
            r.start();
            r.fail("ProviderUnavailableException: down");
            dao.record(r);

            FetchRequest.Snapshot stored = dao.get(r.getRequestId()).orElseThrow();
            assertEquals(FetchStatus.FAILED, stored.status());
            assertEquals("ProviderUnavailableException: down", stored.error());
        }

        @Test
        @DisplayName("Should return empty for an unknown request id")
        void unknownId() throws Exception {
            assertTrue(dao.get(UUID.randomUUID()).isEmpty());
        }
    }

    @Nested
    @DisplayName("Queries")
    class QueryTests {

        @Test
        @DisplayName("Should list the most recent requests first")
        void recentFirst() throws Exception {
            dao.record(request("AAPL.NASDAQ", "2024-01-02T12:00:00Z"));
            dao.record(request("MSFT.NASDAQ", "2024-01-02T13:00:00Z"));
            dao.record(request("SPY.ARCA", "2024-01-02T11:00:00Z"));

            List<FetchRequest.Snapshot> recent = dao.recent(2);

            assertEquals(2, recent.size());
            assertEquals(InstrumentId.parse("MSFT.NASDAQ"), recent.get(0).instrumentId());
            assertEquals(InstrumentId.parse("AAPL.NASDAQ"), recent.get(1).instrumentId());
        }

        @Test
        @DisplayName("Should filter by status")
        void byStatus() throws Exception {
            FetchRequest done = request("AAPL.NASDAQ", "2024-01-02T12:00:00Z");
            done.start();
            done.complete();
            dao.record(done);
            dao.record(request("MSFT.NASDAQ", "2024-01-02T13:00:00Z"));

            List<FetchRequest.Snapshot> pending = dao.findByStatus(FetchStatus.PENDING);

            assertEquals(1, pending.size());
            assertEquals(InstrumentId.parse("MSFT.NASDAQ"), pending.get(0).instrumentId());
            assertTrue(dao.findByStatus(FetchStatus.IN_PROGRESS).isEmpty());
        }
    }
}
