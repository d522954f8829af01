package com.barvault.dataservice.fetch;

import com.barvault.core.model.Bar;
import com.barvault.core.model.BarSpec;
import com.barvault.core.model.InstrumentDescriptor;
import com.barvault.core.model.InstrumentId;
import com.barvault.core.model.SeriesKey;
import com.barvault.core.model.Venue;
import com.barvault.core.time.Timestamps;
import com.barvault.dataservice.exception.CatalogException;
import com.barvault.dataservice.exception.DataNotFoundException;
import com.barvault.dataservice.exception.ErrorMessages;
import com.barvault.dataservice.exception.ProviderUnavailableException;
import com.barvault.dataservice.exception.RemoteDataException;
import com.barvault.dataservice.fetchlog.FetchLog;
import com.barvault.dataservice.index.AvailabilityIndex;
import com.barvault.dataservice.ratelimit.RateLimiter;
import com.barvault.dataservice.ratelimit.RetryPolicy;
import com.barvault.dataservice.remote.RemoteBars;
import com.barvault.dataservice.remote.RemoteDataClient;
import com.barvault.dataservice.store.ColumnStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Single entry point for bar requests: serves from the store when the index says the range
 * is cached, otherwise fetches from the provider (throttled, retried), persists the result
 * and updates the index.
 *
 * Per fetch the ordering is: descriptor persisted, bars persisted, index updated, result
 * returned. A failed fetch leaves store and index untouched. Concurrent requests for the
 * same (instrument, spec, start, end) share one remote call.
 */
public class FetchOrchestrator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(FetchOrchestrator.class);

    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_ATTEMPT_TIMEOUT = Duration.ofSeconds(120);

    private record InFlightKey(SeriesKey series, Instant start, Instant end) {}

    private final ColumnStore store;
    private final AvailabilityIndex index;
    private final RemoteDataClient remote;
    private final RateLimiter rateLimiter;
    private final RetryPolicy retryPolicy;
    private final TimeframeResolver timeframeResolver;
    private final VenueResolver venueResolver;
    private final FetchLog fetchLog;
    private final Duration connectTimeout;
    private final Duration attemptTimeout;
    private final Clock clock;
    private final ExecutorService attemptExecutor;
    private final Map<InFlightKey, CompletableFuture<FetchResult>> inFlight = new ConcurrentHashMap<>();
    private final Object connectLock = new Object();

    private FetchOrchestrator(Builder b) {
        this.store = b.store;
        this.index = b.index;
        this.remote = b.remote;
        this.rateLimiter = b.rateLimiter;
        this.retryPolicy = b.retryPolicy;
        this.timeframeResolver = b.timeframeResolver;
        this.venueResolver = b.venueResolver;
        this.fetchLog = b.fetchLog;
        this.connectTimeout = b.connectTimeout;
        this.attemptTimeout = b.attemptTimeout;
        this.clock = b.clock;
        AtomicInteger threadCount = new AtomicInteger();
        this.attemptExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "remote-fetch-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public static Builder builder(ColumnStore store, AvailabilityIndex index) {
        return new Builder(store, index);
    }

    /**
     * Parse the instrument id and delegate to {@link #fetchOrLoad(InstrumentId, Instant, Instant, Optional)}.
     */
    public FetchResult fetchOrLoad(String instrumentId, Instant start, Instant end, Optional<String> timeframe)
            throws CatalogException {
        return fetchOrLoad(InstrumentId.parse(instrumentId), start, end, timeframe);
    }

    /**
     * Bars for [start, end] at the given (or auto-detected) timeframe.
     *
     * @throws DataNotFoundException        not cached and the provider is unavailable or returned nothing
     * @throws ProviderUnavailableException the provider kept failing until retries ran out
     * @throws CatalogException             store failures and fatal provider errors
     */
    public FetchResult fetchOrLoad(InstrumentId instrumentId, Instant start, Instant end, Optional<String> timeframe)
            throws CatalogException {
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("start " + start + " is after end " + end);
        }
        BarSpec spec = timeframeResolver.resolve(timeframe, start, end);
        SeriesKey key = new SeriesKey(instrumentId, spec);

        if (index.coversRange(key, start, end)) {
            log.debug("Cache hit for {} [{}, {}]", key, start, end);
            return loadFromCache(key, start, end);
        }

        log.info("Cache miss for {} [{}, {}], available: {}", key, start, end,
            index.get(key).map(a -> a.start() + " to " + a.end()).orElse("none"));

        InFlightKey flightKey = new InFlightKey(key, start, end);
        CompletableFuture<FetchResult> mine = new CompletableFuture<>();
        CompletableFuture<FetchResult> existing = inFlight.putIfAbsent(flightKey, mine);
        if (existing != null) {
            log.debug("Joining in-flight fetch for {} [{}, {}]", key, start, end);
            return await(existing);
        }

        try {
            FetchResult result;
            // Another caller may have finished the same fetch between our miss and putIfAbsent
            if (index.coversRange(key, start, end)) {
                result = loadFromCache(key, start, end);
            } else {
                result = fetchRemote(key, start, end);
            }
            mine.complete(result);
            return result;
        } catch (CatalogException | RuntimeException e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(flightKey, mine);
        }
    }

    /**
     * Return the stored descriptor, fetching and persisting it first if it is missing.
     * Only the descriptor is fetched, never bars.
     */
    public InstrumentDescriptor ensureDescriptor(InstrumentId instrumentId) throws CatalogException {
        Optional<InstrumentDescriptor> stored = store.loadDescriptor(instrumentId);
        if (stored.isPresent()) {
            return stored.get();
        }

        log.info("Descriptor missing for {}, backfilling", instrumentId);
        ensureConnected();
        InstrumentDescriptor descriptor = retryPolicy.execute(attempt -> {
            rateLimiter.acquire();
            return callWithTimeout(() -> remote.fetchDescriptor(instrumentId));
        });
        requireMatchingId(instrumentId, descriptor);
        store.write(descriptor);
        log.info("Backfilled descriptor for {}", instrumentId);
        return descriptor;
    }

    public AvailabilityIndex getIndex() {
        return index;
    }

    public ColumnStore getStore() {
        return store;
    }

    @Override
    public void close() {
        attemptExecutor.shutdownNow();
    }

    // ========== Cache path ==========

    private FetchResult loadFromCache(SeriesKey key, Instant start, Instant end) throws CatalogException {
        List<Bar> bars = store.query(key.instrumentId(), key.barSpec(),
            windowStart(key.barSpec(), start), windowEnd(key.barSpec(), end));
        Optional<InstrumentDescriptor> stored = store.loadDescriptor(key.instrumentId());

        FetchResult.Source source = FetchResult.Source.CACHE;
        InstrumentDescriptor descriptor;
        if (stored.isPresent()) {
            descriptor = stored.get();
        } else {
            descriptor = ensureDescriptor(key.instrumentId());
            source = FetchResult.Source.CACHE_WITH_BACKFILL;
        }

        Venue venue = venueResolver.resolve(key.instrumentId(), descriptor);
        log.info("Loaded {} bars for {} from cache", bars.size(), key);
        return new FetchResult(bars, descriptor, venue, key.barSpec(), source);
    }

    // ========== Remote path ==========

    private FetchResult fetchRemote(SeriesKey key, Instant start, Instant end) throws CatalogException {
        InstrumentId instrumentId = key.instrumentId();
        BarSpec spec = key.barSpec();

        try {
            ensureConnected();
        } catch (ProviderUnavailableException e) {
            log.error("Provider unavailable, cannot fetch {} [{}, {}]: {}", key, start, end, e.getMessage());
            DataNotFoundException notFound = new DataNotFoundException(instrumentId.toString(), start, end,
                ErrorMessages.DATA_NOT_FOUND_NO_PROVIDER.format());
            notFound.initCause(e);
            throw notFound;
        }

        FetchRequest request = new FetchRequest(instrumentId, spec, start, end, retryPolicy.getMaxRetries(), clock);
        String correlationId = request.getRequestId().toString();
        fetchLog.record(request);

        RemoteBars fetched = retryPolicy.execute(attempt -> {
            request.start();
            fetchLog.record(request);
            try {
                rateLimiter.acquire();
                log.info("[{}] Fetching {} [{}, {}], attempt {}/{}", correlationId, key, start, end,
                    attempt, retryPolicy.getMaxAttempts());
                return callWithTimeout(() -> remote.fetchBars(instrumentId, spec, start, end));
            } catch (Exception e) {
                request.fail(describe(e));
                fetchLog.record(request);
                throw e;
            }
        }, (retryNumber, delay, error) -> {
            request.retry();
            fetchLog.record(request);
        });

        Instant windowStart = windowStart(spec, start);
        Instant windowEnd = windowEnd(spec, end);
        try {
            if (fetched == null) {
                throw RemoteDataException.fatal("Provider returned no result for " + key);
            }
            List<Bar> bars = acceptedBars(key, fetched.bars(), windowStart, windowEnd, correlationId);
            if (bars.isEmpty()) {
                throw new DataNotFoundException(instrumentId.toString(), start, end,
                    ErrorMessages.DATA_NOT_FOUND_EMPTY.format());
            }

            InstrumentDescriptor descriptor = fetched.descriptor();
            if (descriptor == null) {
                descriptor = retryPolicy.execute(attempt -> {
                    rateLimiter.acquire();
                    return callWithTimeout(() -> remote.fetchDescriptor(instrumentId));
                });
            }
            requireMatchingId(instrumentId, descriptor);

            store.write(descriptor);
            store.write(bars, windowStart, windowEnd, correlationId);
            index.refresh(store, key);

            request.complete();
            fetchLog.record(request);
            log.info("[{}] Persisted {} bars for {} [{}, {}]", correlationId, bars.size(), key, start, end);

            Venue venue = venueResolver.resolve(instrumentId, descriptor);
            return new FetchResult(bars, descriptor, venue, spec, FetchResult.Source.REMOTE);
        } catch (CatalogException | RuntimeException e) {
            request.fail(describe(e));
            fetchLog.record(request);
            throw e;
        }
    }

    private List<Bar> acceptedBars(SeriesKey key, List<Bar> bars, Instant start, Instant end, String correlationId)
            throws RemoteDataException {
        List<Bar> accepted = new ArrayList<>(bars.size());
        int outOfRange = 0;
        for (Bar bar : bars) {
            if (!bar.barType().seriesKey().equals(key)) {
                throw RemoteDataException.fatal("Provider returned bars for " + bar.barType() + ", expected " + key);
            }
            Instant t = bar.eventTime();
            if (t.isBefore(start) || t.isAfter(end)) {
                outOfRange++;
                continue;
            }
            accepted.add(bar);
        }
        if (outOfRange > 0) {
            log.warn("[{}] Dropped {} bars outside [{}, {}]", correlationId, outOfRange, start, end);
        }
        return accepted;
    }

    /**
     * Calendar specs are covered by UTC date, so a day's bar counts as in range wherever
     * the provider stamps it (midnight or 23:59:59).
     */
    private static Instant windowStart(BarSpec spec, Instant start) {
        return spec.isCalendarGranularity() ? Timestamps.startOfUtcDay(start) : start;
    }

    private static Instant windowEnd(BarSpec spec, Instant end) {
        return spec.isCalendarGranularity() ? Timestamps.endOfUtcDay(end) : end;
    }

    private void ensureConnected() throws ProviderUnavailableException {
        if (remote == null) {
            throw new ProviderUnavailableException("No remote data provider configured", 0, null);
        }
        synchronized (connectLock) {
            if (remote.isConnected()) {
                return;
            }
            try {
                remote.connect(connectTimeout);
            } catch (ProviderUnavailableException e) {
                throw e;
            } catch (CatalogException e) {
                throw new ProviderUnavailableException("Connect failed: " + e.getMessage(), 1, e);
            }
            if (!remote.isConnected()) {
                throw new ProviderUnavailableException("Provider did not report a connection", 1, null);
            }
        }
    }

    /**
     * Run one remote call on the attempt executor, bounded by the attempt timeout.
     * A timed-out call is abandoned and reported as {@link TimeoutException}.
     */
    private <T> T callWithTimeout(Callable<T> call) throws Exception {
        Future<T> future = attemptExecutor.submit(call);
        try {
            return future.get(attemptTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new TimeoutException("Remote call timed out after " + attemptTimeout.toSeconds() + "s");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception ex) {
                throw ex;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw e;
        }
    }

    private static FetchResult await(CompletableFuture<FetchResult> future) throws CatalogException {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CatalogException("Interrupted while waiting for in-flight fetch", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof CatalogException catalogError) {
                throw catalogError;
            }
            if (cause instanceof RuntimeException runtimeError) {
                throw runtimeError;
            }
            throw new CatalogException("In-flight fetch failed: " + cause.getMessage(), cause);
        }
    }

    private static void requireMatchingId(InstrumentId expected, InstrumentDescriptor descriptor)
            throws RemoteDataException {
        if (descriptor == null) {
            throw RemoteDataException.fatal("Provider returned no descriptor for " + expected);
        }
        if (!expected.equals(descriptor.instrumentId())) {
            throw RemoteDataException.fatal("Provider returned descriptor for " + descriptor.instrumentId()
                + ", expected " + expected);
        }
    }

    private static String describe(Exception e) {
        String message = e.getMessage();
        return e.getClass().getSimpleName() + (message == null ? "" : ": " + message);
    }

    /**
     * Wiring for {@link FetchOrchestrator}. Store and index are required; everything else has
     * a default. Without a remote client only cached ranges can be served.
     */
    public static class Builder {
        private final ColumnStore store;
        private final AvailabilityIndex index;
        private RemoteDataClient remote;
        private RateLimiter rateLimiter = RateLimiter.slidingWindow(50, 0.9, Duration.ofSeconds(1));
        private RetryPolicy retryPolicy = RetryPolicy.defaults();
        private TimeframeResolver timeframeResolver = new TimeframeResolver();
        private VenueResolver venueResolver = VenueResolver.standard(Venue.SIM);
        private FetchLog fetchLog = FetchLog.NONE;
        private Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;
        private Duration attemptTimeout = DEFAULT_ATTEMPT_TIMEOUT;
        private Clock clock = Clock.systemUTC();

        private Builder(ColumnStore store, AvailabilityIndex index) {
            this.store = store;
            this.index = index;
        }

        public Builder remote(RemoteDataClient remote) {
            this.remote = remote;
            return this;
        }

        public Builder rateLimiter(RateLimiter rateLimiter) {
            this.rateLimiter = rateLimiter;
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder timeframeResolver(TimeframeResolver timeframeResolver) {
            this.timeframeResolver = timeframeResolver;
            return this;
        }

        public Builder venueResolver(VenueResolver venueResolver) {
            this.venueResolver = venueResolver;
            return this;
        }

        public Builder fetchLog(FetchLog fetchLog) {
            this.fetchLog = fetchLog;
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder attemptTimeout(Duration attemptTimeout) {
            this.attemptTimeout = attemptTimeout;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public FetchOrchestrator build() {
            if (store == null || index == null) {
                throw new IllegalStateException("store and index are required");
            }
            return new FetchOrchestrator(this);
        }
    }
}
