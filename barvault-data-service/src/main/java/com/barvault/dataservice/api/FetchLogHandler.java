package com.barvault.dataservice.api;

import com.barvault.dataservice.fetch.FetchRequest;
import com.barvault.dataservice.fetch.FetchStatus;
import com.barvault.dataservice.fetchlog.FetchLogDao;
import io.javalin.http.Context;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Handler for the fetch audit log.
 */
public class FetchLogHandler {
    private static final Logger LOG = LoggerFactory.getLogger(FetchLogHandler.class);

    static final int DEFAULT_LIMIT = 50;
    static final int MAX_LIMIT = 1000;

    private final FetchLogDao dao;

    public FetchLogHandler(FetchLogDao dao) {
        this.dao = dao;
    }

    /**
     * GET /fetches?limit=N&status=S
     * Most recent fetch requests first (default 50, max 1000), optionally filtered by status.
     */
    public void getFetches(Context ctx) {
        int limit;
        FetchStatus status = null;
        try {
            String limitParam = ctx.queryParam("limit");
            limit = limitParam == null ? DEFAULT_LIMIT : Integer.parseInt(limitParam);
            if (limit <= 0) {
                throw new IllegalArgumentException("limit must be > 0");
            }
            limit = Math.min(limit, MAX_LIMIT);
            String statusParam = ctx.queryParam("status");
            if (statusParam != null) {
                status = FetchStatus.valueOf(statusParam.toUpperCase(Locale.ROOT));
            }
        } catch (IllegalArgumentException e) {
            ctx.status(400).json(new ErrorResponse(e.getMessage()));
            return;
        }

        try {
            List<FetchRequest.Snapshot> snapshots = status == null
                ? dao.recent(limit)
                : dao.findByStatus(status).stream().limit(limit).toList();
            ctx.json(new FetchListResponse(snapshots.stream().map(FetchInfo::from).toList()));
        } catch (SQLException e) {
            LOG.error("Failed to read fetch log", e);
            ctx.status(500).json(new ErrorResponse(e.getMessage()));
        }
    }

    public record FetchInfo(
        String requestId,
        String instrumentId,
        String barSpec,
        Instant start,
        Instant end,
        FetchStatus status,
        int retryCount,
        int maxRetries,
        String error,
        Instant createdAt,
        Instant completedAt
    ) {
        static FetchInfo from(FetchRequest.Snapshot s) {
            return new FetchInfo(s.requestId().toString(), s.instrumentId().toString(), s.barSpec().toString(),
                s.start(), s.end(), s.status(), s.retryCount(), s.maxRetries(), s.error(), s.createdAt(),
                s.completedAt());
        }
    }

    public record FetchListResponse(List<FetchInfo> fetches) {}
}
