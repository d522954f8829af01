package com.barvault.dataservice.fetch;

import com.barvault.core.model.BarSpec;
import com.barvault.core.model.InstrumentId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class FetchRequestTest {

    private static final Instant NOW = Instant.parse("2024-01-02T12:00:00Z");

    private FetchRequest request;

    @BeforeEach
    void setUp() {
        request = new FetchRequest(InstrumentId.parse("AAPL.NASDAQ"), BarSpec.ONE_MINUTE_LAST,
            Instant.parse("2024-01-02T09:30:00Z"), Instant.parse("2024-01-02T10:30:00Z"), 2,
            Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Nested
    @DisplayName("Legal transitions")
    class LegalTests {

        @Test
        @DisplayName("Should go PENDING -> IN_PROGRESS -> COMPLETED")
        void happyPath() {
            assertEquals(FetchStatus.PENDING, request.getStatus());

            request.start();
            request.complete();

            FetchRequest.Snapshot s = request.snapshot();
            assertEquals(FetchStatus.COMPLETED, s.status());
            assertEquals(NOW, s.completedAt());
            assertTrue(request.isTerminal());
        }

        @Test
        @DisplayName("Should retry a failed request while retries remain")
        void retryCycle() {
            request.start();
            request.fail("HTTP 503");
            assertEquals("HTTP 503", request.getError());
            assertFalse(request.isTerminal());

            request.retry();

            assertEquals(FetchStatus.PENDING, request.getStatus());
            assertEquals(1, request.getRetryCount());
            assertNull(request.snapshot().completedAt());
        }

        @Test
        @DisplayName("Should become terminal once retries are used up")
        void terminalAfterMaxRetries() {
            for (int i = 0; i < 2; i++) {
                request.start();
                request.fail("down");
                request.retry();
            }
            request.start();
            request.fail("down");

            assertTrue(request.isTerminal());
            assertThrows(IllegalStateException.class, request::retry);
            assertEquals(2, request.getRetryCount());
        }
    }

    @Nested
    @DisplayName("Illegal transitions")
    class IllegalTests {

        @Test
        @DisplayName("Should not complete a request that never started")
        void completeFromPending() {
            assertThrows(IllegalStateException.class, request::complete);
        }

        @Test
        @DisplayName("Should not retry a request that has not failed")
        void retryFromInProgress() {
            request.start();
            assertThrows(IllegalStateException.class, request::retry);
        }

        @Test
        @DisplayName("Should not leave COMPLETED")
        void completedIsFinal() {
            request.start();
            request.complete();

            assertThrows(IllegalStateException.class, request::start);
            assertThrows(IllegalStateException.class, () -> request.fail("late"));
        }

        @Test
        @DisplayName("Should reject negative max retries")
        void rejectsNegativeMaxRetries() {
            assertThrows(IllegalArgumentException.class, () -> new FetchRequest(InstrumentId.parse("AAPL.NASDAQ"),
                BarSpec.ONE_MINUTE_LAST, NOW, NOW, -1, Clock.systemUTC()));
        }
    }
}
