package com.barvault.dataservice.api;

import com.barvault.core.model.BarSpec;
import com.barvault.core.model.InstrumentId;
import com.barvault.core.model.SeriesKey;
import com.barvault.core.model.TimeRangeAvailability;
import com.barvault.core.time.Timestamps;
import com.barvault.dataservice.index.AvailabilityIndex;
import com.barvault.dataservice.store.ColumnStore;
import com.barvault.dataservice.store.PartitionMeta;
import io.javalin.http.Context;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Handler for cache coverage endpoints. Read-only, never triggers a remote fetch.
 */
public class CoverageHandler {
    private static final Logger LOG = LoggerFactory.getLogger(CoverageHandler.class);

    private final ColumnStore store;
    private final AvailabilityIndex index;

    public CoverageHandler(ColumnStore store, AvailabilityIndex index) {
        this.store = store;
        this.index = index;
    }

    /**
     * GET /coverage
     * All availability records, ordered by series key.
     */
    public void getAllCoverage(Context ctx) {
        List<CoverageInfo> coverage = index.snapshot().values().stream()
            .map(CoverageInfo::from)
            .sorted(Comparator.comparing(CoverageInfo::instrumentId).thenComparing(CoverageInfo::barSpec))
            .toList();
        ctx.json(new CoverageListResponse(coverage));
    }

    /**
     * GET /coverage/{instrumentId}/{barSpec}?start=X&end=Y
     * Coverage for one series, with covered/overlaps flags when a range is given.
     */
    public void getCoverage(Context ctx) {
        SeriesKey key;
        try {
            InstrumentId instrumentId = InstrumentId.parse(decode(ctx.pathParam("instrumentId")));
            BarSpec barSpec = BarSpec.parse(decode(ctx.pathParam("barSpec")));
            key = new SeriesKey(instrumentId, barSpec);
        } catch (IllegalArgumentException e) {
            ctx.status(400).json(new ErrorResponse(e.getMessage()));
            return;
        }

        String startParam = ctx.queryParam("start");
        String endParam = ctx.queryParam("end");
        if ((startParam == null) != (endParam == null)) {
            ctx.status(400).json(new ErrorResponse("start and end must be given together"));
            return;
        }

        Optional<TimeRangeAvailability> availability = index.get(key);
        Boolean covered = null;
        Boolean overlaps = null;
        if (startParam != null) {
            Instant start;
            Instant end;
            try {
                start = Timestamps.parse(startParam);
                end = Timestamps.parse(endParam);
            } catch (IllegalArgumentException e) {
                ctx.status(400).json(new ErrorResponse(e.getMessage()));
                return;
            }
            if (start.isAfter(end)) {
                ctx.status(400).json(new ErrorResponse("start must not be after end"));
                return;
            }
            covered = index.coversRange(key, start, end);
            overlaps = index.overlapsRange(key, start, end);
        }

        if (availability.isEmpty() && covered == null) {
            ctx.status(404).json(new ErrorResponse("No cached data for " + key));
            return;
        }
        ctx.json(new SeriesCoverageResponse(key.toString(), availability.map(CoverageInfo::from).orElse(null),
            covered, overlaps));
    }

    /**
     * GET /partitions
     * Every readable partition file in the store.
     */
    public void getPartitions(Context ctx) {
        try {
            List<PartitionInfo> partitions = store.scanPartitions().stream()
                .map(PartitionInfo::from)
                .toList();
            ctx.json(new PartitionListResponse(partitions.size(), partitions));
        } catch (RuntimeException e) {
            LOG.error("Failed to scan partitions", e);
            ctx.status(500).json(new ErrorResponse(e.getMessage()));
        }
    }

    private static String decode(String value) {
        return URLDecoder.decode(value, StandardCharsets.UTF_8);
    }

    // Response records
    public record CoverageInfo(
        String instrumentId,
        String barSpec,
        Instant start,
        Instant end,
        int fileCount,
        long estimatedRowCount,
        Instant lastUpdated
    ) {
        static CoverageInfo from(TimeRangeAvailability a) {
            return new CoverageInfo(a.instrumentId().toString(), a.barSpec().toString(), a.start(), a.end(),
                a.fileCount(), a.estimatedRowCount(), a.lastUpdated());
        }
    }

    public record CoverageListResponse(List<CoverageInfo> coverage) {}

    public record SeriesCoverageResponse(String seriesKey, CoverageInfo availability, Boolean covered,
                                         Boolean overlaps) {}

    public record PartitionInfo(
        String barType,
        String file,
        Instant start,
        Instant end,
        long sizeBytes,
        long rowCount,
        Instant writtenAt
    ) {
        static PartitionInfo from(PartitionMeta m) {
            return new PartitionInfo(m.barType().toString(), m.file().getFileName().toString(), m.start(), m.end(),
                m.sizeBytes(), m.rowCount(), Timestamps.fromEpochNanos(m.writtenAtNs()));
        }
    }

    public record PartitionListResponse(int count, List<PartitionInfo> partitions) {}
}
