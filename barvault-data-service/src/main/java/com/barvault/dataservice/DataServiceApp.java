package com.barvault.dataservice;

import com.barvault.core.model.BarSpec;
import com.barvault.core.model.InstrumentId;
import com.barvault.dataservice.api.DataServiceServer;
import com.barvault.dataservice.config.DataServiceConfig;
import com.barvault.dataservice.fetch.FetchOrchestrator;
import com.barvault.dataservice.fetch.VenueResolver;
import com.barvault.dataservice.fetchlog.FetchLogConnection;
import com.barvault.dataservice.fetchlog.FetchLogDao;
import com.barvault.dataservice.importer.CsvBarImporter;
import com.barvault.dataservice.importer.ImportResult;
import com.barvault.dataservice.index.AvailabilityIndex;
import com.barvault.dataservice.ratelimit.RateLimiter;
import com.barvault.dataservice.ratelimit.RetryPolicy;
import com.barvault.dataservice.remote.HttpRemoteDataClient;
import com.barvault.dataservice.store.ColumnStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;

/**
 * BarVault Data Service - bar cache daemon serving bars and cache inspection over HTTP.
 *
 * Usage:
 * <pre>
 * DataServiceApp                                     run the service
 * DataServiceApp import FILE INSTRUMENT_ID BAR_SPEC  import a CSV file and exit
 * </pre>
 */
public class DataServiceApp {
    private static final Logger LOG = LoggerFactory.getLogger(DataServiceApp.class);

    private static final CountDownLatch shutdownLatch = new CountDownLatch(1);
    private static DataServiceServer server;
    private static FetchOrchestrator orchestrator;
    private static FetchLogConnection fetchLogConnection;

    public static void main(String[] args) {
        try {
            DataServiceConfig config = DataServiceConfig.load();

            if (args.length > 0 && "import".equals(args[0])) {
                System.exit(runImport(config, args));
            }

            LOG.info("Starting BarVault Data Service...");
            ColumnStore store = new ColumnStore(config.getDataDir());
            AvailabilityIndex index = new AvailabilityIndex();
            index.rebuild(store);

            fetchLogConnection = new FetchLogConnection(config.getFetchLogPath());
            fetchLogConnection.initializeSchema();
            FetchLogDao fetchLogDao = new FetchLogDao(fetchLogConnection);
            LOG.info("Fetch log at {}", config.getFetchLogPath());

            orchestrator = buildOrchestrator(config, store, index, fetchLogDao);
            server = new DataServiceServer(config.getPort(), store, index, fetchLogDao, orchestrator);

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                LOG.info("Shutting down BarVault Data Service...");
                cleanup();
                shutdownLatch.countDown();
            }));

            int port = server.start();
            LOG.info("BarVault Data Service started on port {} with {} cached series", port, index.size());

            shutdownLatch.await();

        } catch (Exception e) {
            LOG.error("Failed to start Data Service", e);
            cleanup();
            System.exit(1);
        }
    }

    static FetchOrchestrator buildOrchestrator(DataServiceConfig config, ColumnStore store, AvailabilityIndex index,
                                               FetchLogDao fetchLogDao) {
        FetchOrchestrator.Builder builder = FetchOrchestrator.builder(store, index)
            .rateLimiter(RateLimiter.slidingWindow(config.getRequestsPerSecond(), config.getSafetyFraction(),
                Duration.ofSeconds(1)))
            .retryPolicy(new RetryPolicy(config.getMaxRetries(), config.getBaseDelay(), config.getBackoffMultiplier()))
            .venueResolver(VenueResolver.standard(config.getDefaultVenue()))
            .fetchLog(fetchLogDao)
            .connectTimeout(config.getConnectTimeout())
            .attemptTimeout(config.getAttemptTimeout());

        config.getProviderBaseUrl().ifPresentOrElse(
            url -> {
                builder.remote(new HttpRemoteDataClient(url, config.getConnectTimeout()));
                LOG.info("Remote provider: {}", url);
            },
            () -> LOG.warn("No provider.baseUrl configured, serving cached data only"));
        return builder.build();
    }

    private static int runImport(DataServiceConfig config, String[] args) throws Exception {
        if (args.length != 4) {
            System.err.println("Usage: import FILE INSTRUMENT_ID BAR_SPEC");
            return 2;
        }
        Path file = Paths.get(args[1]);
        InstrumentId instrumentId = InstrumentId.parse(args[2]);
        BarSpec barSpec = BarSpec.parse(args[3]);

        ColumnStore store = new ColumnStore(config.getDataDir());
        AvailabilityIndex index = new AvailabilityIndex();
        index.rebuild(store);

        ImportResult result = new CsvBarImporter(store, index, config.getConflictPolicy())
            .importFile(file, instrumentId, barSpec);

        System.out.printf("%s: %d rows, %d bars written, %d skipped, %d errors (%s)%n",
            result.file().getFileName(), result.rowsProcessed(), result.barsWritten(),
            result.conflictsSkipped(), result.validationErrors().size(), result.dateRange());
        result.validationErrors().forEach(System.out::println);
        return result.hasErrors() ? 1 : 0;
    }

    private static synchronized void cleanup() {
        if (server != null) {
            server.stop();
            server = null;
        }
        if (orchestrator != null) {
            orchestrator.close();
            orchestrator = null;
        }
        if (fetchLogConnection != null) {
            fetchLogConnection.close();
            fetchLogConnection = null;
        }
    }
}
