package com.barvault.dataservice.remote;

import com.barvault.core.model.AssetClass;
import com.barvault.core.model.Bar;
import com.barvault.core.model.BarSpec;
import com.barvault.core.model.InstrumentDescriptor;
import com.barvault.core.model.InstrumentId;
import com.barvault.dataservice.exception.ProviderUnavailableException;
import com.barvault.dataservice.exception.RateLimitExceededException;
import com.barvault.dataservice.exception.RemoteDataException;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class HttpRemoteDataClientTest {

    private static final InstrumentId AAPL = InstrumentId.parse("AAPL.NASDAQ");
    private static final Instant START = Instant.parse("2024-01-02T09:30:00Z");
    private static final Instant END = Instant.parse("2024-01-02T09:32:00Z");
    private static final Instant NOW = Instant.parse("2024-01-03T00:00:00Z");

    private static final String DESCRIPTOR_JSON = """
        {"instrumentId": "AAPL.NASDAQ", "assetClass": "EQUITY", "quoteCurrency": "USD",
         "pricePrecision": 2, "tickSize": 0.01, "description": "Apple Inc."}""";

    private MockWebServer server;
    private HttpRemoteDataClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        client = new HttpRemoteDataClient(server.url("/"), new OkHttpClient(), HttpClientFactory.getMapper(),
            Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Nested
    @DisplayName("Bars")
    class BarsTests {

        @Test
        @DisplayName("Should parse bars and the descriptor")
        void parsesBars() throws Exception {
            // Given
            server.enqueue(new MockResponse().setBody("""
                {"instrument": %s,
                 "bars": [
                   {"timestamp": "2024-01-02T09:30:00Z", "open": "185.10", "high": "185.50",
                    "low": "185.00", "close": "185.40", "volume": 12000},
                   {"timestamp": 1704187860000, "open": 185.40, "high": 185.60,
                    "low": 185.20, "close": 185.25, "volume": 8000}
                 ]}""".formatted(DESCRIPTOR_JSON)));

            // When
            RemoteBars result = client.fetchBars(AAPL, BarSpec.ONE_MINUTE_LAST, START, END);

            // Then
            assertEquals(2, result.bars().size());
            Bar first = result.bars().get(0);
            assertEquals(START, first.eventTime());
            assertEquals(NOW, first.ingestTime());
            assertEquals(new BigDecimal("185.40"), first.close());
            assertEquals(START.plusSeconds(60), result.bars().get(1).eventTime());
            assertEquals(AAPL, first.barType().instrumentId());

            InstrumentDescriptor descriptor = result.descriptor();
            assertEquals(AAPL, descriptor.instrumentId());
            assertEquals(AssetClass.EQUITY, descriptor.assetClass());

            RecordedRequest request = server.takeRequest();
            assertEquals("/bars", request.getRequestUrl().encodedPath());
            assertEquals("AAPL.NASDAQ", request.getRequestUrl().queryParameter("instrument"));
            assertEquals("1-MINUTE-LAST", request.getRequestUrl().queryParameter("spec"));
            assertEquals(START.toString(), request.getRequestUrl().queryParameter("start"));
        }

        @Test
        @DisplayName("Should map 429 to a rate limit error with Retry-After")
        void rateLimited() {
            server.enqueue(new MockResponse().setResponseCode(429).setHeader("Retry-After", "7"));

            RateLimitExceededException e = assertThrows(RateLimitExceededException.class,
                () -> client.fetchBars(AAPL, BarSpec.ONE_MINUTE_LAST, START, END));

            assertEquals(7000, e.getRetryAfterMs());
        }

        @Test
        @DisplayName("Should map 5xx to a retryable error")
        void serverErrorIsRetryable() {
            server.enqueue(new MockResponse().setResponseCode(503));

            RemoteDataException e = assertThrows(RemoteDataException.class,
                () -> client.fetchBars(AAPL, BarSpec.ONE_MINUTE_LAST, START, END));

            assertTrue(e.isRetryable());
        }

        @Test
        @DisplayName("Should map 404 to a fatal error")
        void notFoundIsFatal() {
            server.enqueue(new MockResponse().setResponseCode(404).setBody("unknown instrument"));

            RemoteDataException e = assertThrows(RemoteDataException.class,
                () -> client.fetchBars(AAPL, BarSpec.ONE_MINUTE_LAST, START, END));

            assertFalse(e.isRetryable());
            assertTrue(e.getMessage().contains("unknown instrument"));
        }

        @Test
        @DisplayName("Should reject bars that break OHLC invariants")
        void malformedBar() {
            server.enqueue(new MockResponse().setBody("""
                {"bars": [{"timestamp": "2024-01-02T09:30:00Z", "open": "10", "high": "9",
                           "low": "11", "close": "10", "volume": 1}]}"""));

            RemoteDataException e = assertThrows(RemoteDataException.class,
                () -> client.fetchBars(AAPL, BarSpec.ONE_MINUTE_LAST, START, END));

            assertFalse(e.isRetryable());
        }

        @Test
        @DisplayName("Should return no descriptor when the response omits it")
        void missingDescriptor() throws Exception {
            server.enqueue(new MockResponse().setBody("{\"bars\": []}"));

            RemoteBars result = client.fetchBars(AAPL, BarSpec.ONE_MINUTE_LAST, START, END);

            assertTrue(result.isEmpty());
            assertNull(result.descriptor());
        }
    }

    @Nested
    @DisplayName("Descriptors and connection")
    class ConnectionTests {

        @Test
        @DisplayName("Should fetch a descriptor by instrument id")
        void fetchesDescriptor() throws Exception {
            server.enqueue(new MockResponse().setBody(DESCRIPTOR_JSON));

            InstrumentDescriptor descriptor = client.fetchDescriptor(AAPL);

            assertEquals("Apple Inc.", descriptor.description());
            assertEquals("/instruments/AAPL.NASDAQ", server.takeRequest().getRequestUrl().encodedPath());
        }

        @Test
        @DisplayName("Should connect when the ping succeeds")
        void connects() throws Exception {
            server.enqueue(new MockResponse().setBody("pong"));

            assertFalse(client.isConnected());
            client.connect(Duration.ofSeconds(5));

            assertTrue(client.isConnected());
            assertEquals("/ping", server.takeRequest().getPath());
        }

        @Test
        @DisplayName("Should report the provider unavailable when the ping fails")
        void pingFails() {
            server.enqueue(new MockResponse().setResponseCode(503));

            assertThrows(ProviderUnavailableException.class, () -> client.connect(Duration.ofSeconds(5)));
            assertFalse(client.isConnected());
        }
    }
}
