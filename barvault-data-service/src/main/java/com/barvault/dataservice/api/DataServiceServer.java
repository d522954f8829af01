package com.barvault.dataservice.api;

import com.barvault.dataservice.fetch.FetchOrchestrator;
import com.barvault.dataservice.fetchlog.FetchLogDao;
import com.barvault.dataservice.index.AvailabilityIndex;
import com.barvault.dataservice.store.ColumnStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.javalin.Javalin;
import io.javalin.json.JavalinJackson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP API of the data service. Coverage, partition and fetch-log routes only read;
 * /bars goes through the fetch orchestrator and may call the provider.
 */
public class DataServiceServer {
    private static final Logger LOG = LoggerFactory.getLogger(DataServiceServer.class);

    private final int port;
    private final ColumnStore store;
    private final AvailabilityIndex index;
    private final FetchLogDao fetchLogDao;
    private final FetchOrchestrator orchestrator;
    private final ObjectMapper objectMapper;
    private Javalin app;

    public DataServiceServer(int port, ColumnStore store, AvailabilityIndex index, FetchLogDao fetchLogDao) {
        this(port, store, index, fetchLogDao, null);
    }

    /**
     * @param fetchLogDao  may be null, in which case /fetches answers 503
     * @param orchestrator may be null, in which case /bars answers 503
     */
    public DataServiceServer(int port, ColumnStore store, AvailabilityIndex index, FetchLogDao fetchLogDao,
                             FetchOrchestrator orchestrator) {
        this.port = port;
        this.store = store;
        this.index = index;
        this.fetchLogDao = fetchLogDao;
        this.orchestrator = orchestrator;
        this.objectMapper = createObjectMapper();
    }

    private ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    /**
     * @return the bound port, which differs from the configured one when that was 0
     */
    public int start() {
        app = Javalin.create(javalinConfig -> {
            javalinConfig.jsonMapper(new JavalinJackson(objectMapper, false));
            javalinConfig.showJavalinBanner = false;
        });

        configureBarRoutes();
        configureCoverageRoutes();
        configureFetchLogRoutes();
        configureHealthRoutes();

        app.start(port);
        LOG.info("Data service API listening on port {}", app.port());
        return app.port();
    }

    public void stop() {
        if (app != null) {
            app.stop();
            app = null;
        }
    }

    private void configureBarRoutes() {
        if (orchestrator == null) {
            app.get("/bars/{instrumentId}", ctx -> ctx.status(503).json(new ErrorResponse("Bar fetching is not enabled")));
            return;
        }
        BarsHandler barsHandler = new BarsHandler(orchestrator);
        app.get("/bars/{instrumentId}", barsHandler::getBars);
    }

    private void configureCoverageRoutes() {
        CoverageHandler coverageHandler = new CoverageHandler(store, index);

        app.get("/coverage", coverageHandler::getAllCoverage);
        app.get("/coverage/{instrumentId}/{barSpec}", coverageHandler::getCoverage);
        app.get("/partitions", coverageHandler::getPartitions);
    }

    private void configureFetchLogRoutes() {
        if (fetchLogDao == null) {
            app.get("/fetches", ctx -> ctx.status(503).json(new ErrorResponse("Fetch log is not enabled")));
            return;
        }
        FetchLogHandler fetchLogHandler = new FetchLogHandler(fetchLogDao);
        app.get("/fetches", fetchLogHandler::getFetches);
    }

    private void configureHealthRoutes() {
        app.get("/health", ctx -> ctx.json(new HealthResponse("ok", index.size())));
        app.get("/", ctx -> ctx.json(new ServiceInfo("BarVault Data Service", "1.0.0", app.port())));
    }

    public record HealthResponse(String status, int cachedSeries) {}

    public record ServiceInfo(String name, String version, int port) {}
}
