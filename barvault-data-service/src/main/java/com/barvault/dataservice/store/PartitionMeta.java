package com.barvault.dataservice.store;

import com.barvault.core.model.BarType;

import java.nio.file.Path;
import java.time.Instant;

/**
 * One partition file as seen by a directory scan.
 *
 * @param start       covered window start, from the file name
 * @param end         covered window end, from the file name
 * @param rowCount    rows recorded in the file header
 * @param writtenAtNs write time recorded in the file header (epoch nanos)
 */
public record PartitionMeta(
    BarType barType,
    Path file,
    Instant start,
    Instant end,
    long sizeBytes,
    long rowCount,
    long writtenAtNs
) {}
