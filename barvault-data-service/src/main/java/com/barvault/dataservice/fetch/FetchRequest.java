package com.barvault.dataservice.fetch;

import com.barvault.core.model.BarSpec;
import com.barvault.core.model.InstrumentId;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Tracks one remote fetch through its attempts.
 *
 * <pre>
 * PENDING -> IN_PROGRESS -> COMPLETED
 *                        -> FAILED -> PENDING (while retryCount < maxRetries)
 * </pre>
 * COMPLETED is terminal; FAILED is terminal once retries are used up.
 */
public class FetchRequest {

    /**
     * Immutable view of a request at one point in time.
     */
    public record Snapshot(
        UUID requestId,
        InstrumentId instrumentId,
        BarSpec barSpec,
        Instant start,
        Instant end,
        FetchStatus status,
        int retryCount,
        int maxRetries,
        String error,
        Instant createdAt,
        Instant completedAt
    ) {}

    private final UUID requestId;
    private final InstrumentId instrumentId;
    private final BarSpec barSpec;
    private final Instant start;
    private final Instant end;
    private final int maxRetries;
    private final Instant createdAt;
    private final Clock clock;

    private FetchStatus status = FetchStatus.PENDING;
    private int retryCount;
    private String error;
    private Instant completedAt;

    public FetchRequest(InstrumentId instrumentId, BarSpec barSpec, Instant start, Instant end,
                        int maxRetries, Clock clock) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        this.requestId = UUID.randomUUID();
        this.instrumentId = instrumentId;
        this.barSpec = barSpec;
        this.start = start;
        this.end = end;
        this.maxRetries = maxRetries;
        this.clock = clock;
        this.createdAt = clock.instant();
    }

    /** PENDING -> IN_PROGRESS. */
    public synchronized void start() {
        requireStatus(FetchStatus.PENDING, "start");
        status = FetchStatus.IN_PROGRESS;
    }

    /** IN_PROGRESS -> COMPLETED. */
    public synchronized void complete() {
        requireStatus(FetchStatus.IN_PROGRESS, "complete");
        status = FetchStatus.COMPLETED;
        error = null;
        completedAt = clock.instant();
    }

    /** IN_PROGRESS -> FAILED. */
    public synchronized void fail(String reason) {
        requireStatus(FetchStatus.IN_PROGRESS, "fail");
        status = FetchStatus.FAILED;
        error = reason;
        completedAt = clock.instant();
    }

    /** FAILED -> PENDING, consuming one retry. */
    public synchronized void retry() {
        requireStatus(FetchStatus.FAILED, "retry");
        if (retryCount >= maxRetries) {
            throw new IllegalStateException("Request " + requestId + " has used all " + maxRetries + " retries");
        }
        retryCount++;
        status = FetchStatus.PENDING;
        completedAt = null;
    }

    public synchronized boolean isTerminal() {
        return status == FetchStatus.COMPLETED
            || (status == FetchStatus.FAILED && retryCount >= maxRetries);
    }

    public synchronized Snapshot snapshot() {
        return new Snapshot(requestId, instrumentId, barSpec, start, end, status, retryCount, maxRetries,
            error, createdAt, completedAt);
    }

    public UUID getRequestId() {
        return requestId;
    }

    public InstrumentId getInstrumentId() {
        return instrumentId;
    }

    public BarSpec getBarSpec() {
        return barSpec;
    }

    public synchronized FetchStatus getStatus() {
        return status;
    }

    public synchronized int getRetryCount() {
        return retryCount;
    }

    public synchronized String getError() {
        return error;
    }

    private void requireStatus(FetchStatus expected, String transition) {
        if (status != expected) {
            throw new IllegalStateException("Cannot " + transition + " request " + requestId
                + " in status " + status);
        }
    }
}
