package com.barvault.dataservice.remote;

import com.barvault.core.model.Bar;
import com.barvault.core.model.BarSpec;
import com.barvault.core.model.BarType;
import com.barvault.core.model.InstrumentDescriptor;
import com.barvault.core.model.InstrumentId;
import com.barvault.core.time.Timestamps;
import com.barvault.dataservice.exception.CatalogException;
import com.barvault.dataservice.exception.ProviderUnavailableException;
import com.barvault.dataservice.exception.RateLimitExceededException;
import com.barvault.dataservice.exception.RemoteDataException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * JSON-over-HTTP market data provider.
 *
 * Endpoints:
 * - GET /ping
 * - GET /bars?instrument=AAPL.NASDAQ&spec=1-MINUTE-LAST&start=...&end=...
 *   returns {"instrument": {descriptor}, "bars": [{"timestamp", "open", "high", "low", "close", "volume"}]}
 * - GET /instruments/{instrumentId} returns a descriptor
 *
 * Bar timestamps may be ISO-8601 strings or epoch milliseconds.
 */
public class HttpRemoteDataClient implements RemoteDataClient {

    private static final Logger log = LoggerFactory.getLogger(HttpRemoteDataClient.class);

    private final HttpUrl baseUrl;
    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final Clock clock;
    private volatile boolean connected;

    public HttpRemoteDataClient(String baseUrl, Duration connectTimeout) {
        this(HttpUrl.get(baseUrl), HttpClientFactory.withConnectTimeout(connectTimeout),
            HttpClientFactory.getMapper(), Clock.systemUTC());
    }

    public HttpRemoteDataClient(HttpUrl baseUrl, OkHttpClient client, ObjectMapper mapper, Clock clock) {
        this.baseUrl = baseUrl;
        this.client = client;
        this.mapper = mapper;
        this.clock = clock;
    }

    @Override
    public RemoteBars fetchBars(InstrumentId instrumentId, BarSpec barSpec, Instant start, Instant end)
            throws CatalogException, IOException {
        HttpUrl url = baseUrl.newBuilder()
            .addPathSegment("bars")
            .addQueryParameter("instrument", instrumentId.toString())
            .addQueryParameter("spec", barSpec.toString())
            .addQueryParameter("start", start.toString())
            .addQueryParameter("end", end.toString())
            .build();

        JsonNode root = getJson(url);
        try {
            InstrumentDescriptor descriptor = root.hasNonNull("instrument")
                ? mapper.treeToValue(root.get("instrument"), InstrumentDescriptor.class)
                : null;

            BarType barType = BarType.external(instrumentId, barSpec);
            long ingestNs = Timestamps.toEpochNanos(clock.instant());
            List<Bar> bars = new ArrayList<>();
            JsonNode barsNode = root.path("bars");
            for (JsonNode node : barsNode) {
                bars.add(new Bar(barType,
                    decimal(node, "open"),
                    decimal(node, "high"),
                    decimal(node, "low"),
                    decimal(node, "close"),
                    node.path("volume").asLong(),
                    eventTimeNs(node.path("timestamp")),
                    ingestNs));
            }
            log.debug("Fetched {} bars for {} {} [{}, {}]", bars.size(), instrumentId, barSpec, start, end);
            return new RemoteBars(bars, descriptor);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new RemoteDataException("Malformed bar response for " + instrumentId + ": " + e.getMessage(), false, e);
        }
    }

    @Override
    public InstrumentDescriptor fetchDescriptor(InstrumentId instrumentId) throws CatalogException, IOException {
        HttpUrl url = baseUrl.newBuilder()
            .addPathSegment("instruments")
            .addPathSegment(instrumentId.toString())
            .build();
        JsonNode root = getJson(url);
        try {
            return mapper.treeToValue(root, InstrumentDescriptor.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new RemoteDataException("Malformed descriptor for " + instrumentId + ": " + e.getMessage(), false, e);
        }
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    @Override
    public void connect(Duration timeout) throws CatalogException {
        OkHttpClient pingClient = client.newBuilder()
            .callTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
            .build();
        Request request = new Request.Builder()
            .url(baseUrl.newBuilder().addPathSegment("ping").build())
            .get()
            .build();

        try (Response response = pingClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                connected = false;
                throw new ProviderUnavailableException("Provider ping failed: HTTP " + response.code(), 1, null);
            }
            connected = true;
            log.info("Connected to market data provider at {}", baseUrl);
        } catch (IOException e) {
            connected = false;
            throw new ProviderUnavailableException("Cannot reach provider at " + baseUrl + ": " + e.getMessage(), 1, e);
        }
    }

    private JsonNode getJson(HttpUrl url) throws CatalogException, IOException {
        Request request = new Request.Builder().url(url).get().build();

        try (Response response = client.newCall(request).execute()) {
            int code = response.code();
            if (code == 429) {
                throw new RateLimitExceededException("Provider rate limit exceeded", retryAfterMs(response));
            }
            if (code >= 500) {
                throw RemoteDataException.transientError("Provider error: HTTP " + code + " " + response.message());
            }
            if (!response.isSuccessful()) {
                throw RemoteDataException.fatal("Provider rejected request: HTTP " + code + " " + bodyText(response));
            }
            ResponseBody body = response.body();
            if (body == null) {
                throw RemoteDataException.transientError("Empty response body from " + url.encodedPath());
            }
            try {
                return mapper.readTree(body.string());
            } catch (JsonProcessingException e) {
                throw new RemoteDataException("Invalid JSON from " + url.encodedPath() + ": " + e.getOriginalMessage(), false, e);
            }
        }
    }

    private static long retryAfterMs(Response response) {
        String header = response.header("Retry-After");
        if (header == null) {
            return 0;
        }
        try {
            return Long.parseLong(header.trim()) * 1000L;
        } catch (NumberFormatException e) {
            log.debug("Ignoring non-numeric Retry-After: {}", header);
            return 0;
        }
    }

    private static String bodyText(Response response) throws IOException {
        ResponseBody body = response.body();
        return body == null ? "" : body.string();
    }

    private static BigDecimal decimal(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new IllegalArgumentException("missing " + field);
        }
        return new BigDecimal(value.asText());
    }

    private static long eventTimeNs(JsonNode timestamp) {
        if (timestamp.isNumber()) {
            return Math.multiplyExact(timestamp.asLong(), 1_000_000L);
        }
        return Timestamps.toEpochNanos(Timestamps.parse(timestamp.asText()));
    }
}
