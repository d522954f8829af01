package com.barvault.dataservice.api;

import com.barvault.core.model.Bar;
import com.barvault.core.model.InstrumentId;
import com.barvault.core.time.Timestamps;
import com.barvault.dataservice.exception.CatalogException;
import com.barvault.dataservice.exception.DataNotFoundException;
import com.barvault.dataservice.exception.ProviderUnavailableException;
import com.barvault.dataservice.fetch.FetchOrchestrator;
import com.barvault.dataservice.fetch.FetchResult;
import io.javalin.http.Context;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Handler for bar requests. Goes through {@link FetchOrchestrator}, so a range that is
 * not cached is fetched from the provider and persisted before it is returned.
 */
public class BarsHandler {
    private static final Logger LOG = LoggerFactory.getLogger(BarsHandler.class);

    private final FetchOrchestrator orchestrator;

    public BarsHandler(FetchOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    /**
     * GET /bars/{instrumentId}?start=X&end=Y[&timeframe=Z]
     */
    public void getBars(Context ctx) {
        InstrumentId instrumentId;
        Instant start;
        Instant end;
        try {
            instrumentId = InstrumentId.parse(URLDecoder.decode(ctx.pathParam("instrumentId"), StandardCharsets.UTF_8));
            String startParam = ctx.queryParam("start");
            String endParam = ctx.queryParam("end");
            if (startParam == null || endParam == null) {
                ctx.status(400).json(new ErrorResponse("start and end are required"));
                return;
            }
            start = Timestamps.parse(startParam);
            end = Timestamps.parse(endParam);
        } catch (IllegalArgumentException e) {
            ctx.status(400).json(new ErrorResponse(e.getMessage()));
            return;
        }

        try {
            FetchResult result = orchestrator.fetchOrLoad(instrumentId, start, end,
                Optional.ofNullable(ctx.queryParam("timeframe")));
            ctx.json(BarsResponse.from(instrumentId, result));
        } catch (IllegalArgumentException e) {
            ctx.status(400).json(new ErrorResponse(e.getMessage()));
        } catch (DataNotFoundException e) {
            ctx.status(404).json(new ErrorResponse(e.getMessage()));
        } catch (ProviderUnavailableException e) {
            LOG.warn("Provider unavailable for {}: {}", instrumentId, e.getMessage());
            ctx.status(503).json(new ErrorResponse(e.getMessage()));
        } catch (CatalogException e) {
            LOG.error("Failed to load bars for {}", instrumentId, e);
            ctx.status(500).json(new ErrorResponse(e.getMessage()));
        }
    }

    // Response records
    public record BarInfo(Instant time, BigDecimal open, BigDecimal high, BigDecimal low, BigDecimal close,
                          long volume) {
        static BarInfo from(Bar bar) {
            return new BarInfo(bar.eventTime(), bar.open(), bar.high(), bar.low(), bar.close(), bar.volume());
        }
    }

    public record BarsResponse(
        String instrumentId,
        String barSpec,
        String venue,
        String source,
        int count,
        List<BarInfo> bars
    ) {
        static BarsResponse from(InstrumentId instrumentId, FetchResult result) {
            List<BarInfo> bars = result.bars().stream().map(BarInfo::from).toList();
            return new BarsResponse(instrumentId.toString(), result.barSpec().toString(),
                result.venue().code(), result.source().name(), bars.size(), bars);
        }
    }
}
