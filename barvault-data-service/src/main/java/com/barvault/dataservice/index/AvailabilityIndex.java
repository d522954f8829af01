package com.barvault.dataservice.index;

import com.barvault.core.model.AggregationSource;
import com.barvault.core.model.BarType;
import com.barvault.core.model.SeriesKey;
import com.barvault.core.model.TimeRangeAvailability;
import com.barvault.core.time.Timestamps;
import com.barvault.dataservice.store.ColumnStore;
import com.barvault.dataservice.store.PartitionMeta;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory index of cached time ranges per (instrument, bar spec).
 *
 * Derived entirely from the partition files in {@link ColumnStore}: {@link #rebuild} scans
 * the store once at startup and {@link #refresh} re-derives a single series after a write.
 * A series' availability spans the earliest partition start to the latest partition end,
 * so gaps between disjoint partitions are not visible here.
 */
public class AvailabilityIndex {

    private static final Logger log = LoggerFactory.getLogger(AvailabilityIndex.class);

    private final Map<SeriesKey, TimeRangeAvailability> entries = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * Replace the whole index with what the store holds now.
     *
     * @return the new entries
     */
    public Map<SeriesKey, TimeRangeAvailability> rebuild(ColumnStore store) {
        Map<SeriesKey, List<PartitionMeta>> grouped = new LinkedHashMap<>();
        for (PartitionMeta meta : store.scanPartitions()) {
            grouped.computeIfAbsent(meta.barType().seriesKey(), k -> new ArrayList<>()).add(meta);
        }

        Map<SeriesKey, TimeRangeAvailability> rebuilt = new HashMap<>();
        grouped.forEach((key, partitions) -> summarize(key, partitions).ifPresent(a -> rebuilt.put(key, a)));

        lock.writeLock().lock();
        try {
            entries.clear();
            entries.putAll(rebuilt);
        } finally {
            lock.writeLock().unlock();
        }

        log.info("Availability index rebuilt: {} series", rebuilt.size());
        return Collections.unmodifiableMap(rebuilt);
    }

    /**
     * Re-derive one series from its partitions, removing it if none are left.
     */
    public Optional<TimeRangeAvailability> refresh(ColumnStore store, SeriesKey key) {
        List<PartitionMeta> partitions = new ArrayList<>();
        for (AggregationSource source : AggregationSource.values()) {
            partitions.addAll(store.listPartitions(new BarType(key.instrumentId(), key.barSpec(), source)));
        }
        Optional<TimeRangeAvailability> availability = summarize(key, partitions);
        lock.writeLock().lock();
        try {
            if (availability.isPresent()) {
                entries.put(key, availability.get());
            } else {
                entries.remove(key);
            }
        } finally {
            lock.writeLock().unlock();
        }
        return availability;
    }

    public void put(SeriesKey key, TimeRangeAvailability availability) {
        if (!key.equals(availability.key())) {
            throw new IllegalArgumentException("Availability for " + availability.key() + " stored under " + key);
        }
        lock.writeLock().lock();
        try {
            entries.put(key, availability);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<TimeRangeAvailability> get(SeriesKey key) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(entries.get(key));
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean coversRange(SeriesKey key, Instant start, Instant end) {
        return get(key).map(a -> a.coversRange(start, end)).orElse(false);
    }

    public boolean overlapsRange(SeriesKey key, Instant start, Instant end) {
        return get(key).map(a -> a.overlapsRange(start, end)).orElse(false);
    }

    public Map<SeriesKey, TimeRangeAvailability> snapshot() {
        lock.readLock().lock();
        try {
            return Map.copyOf(entries);
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    static Optional<TimeRangeAvailability> summarize(SeriesKey key, List<PartitionMeta> partitions) {
        if (partitions.isEmpty()) {
            return Optional.empty();
        }
        Instant start = null;
        Instant end = null;
        long rows = 0;
        long lastWrittenNs = Long.MIN_VALUE;
        for (PartitionMeta p : partitions) {
            start = start == null || p.start().isBefore(start) ? p.start() : start;
            end = end == null || p.end().isAfter(end) ? p.end() : end;
            rows += p.rowCount();
            lastWrittenNs = Math.max(lastWrittenNs, p.writtenAtNs());
        }
        return Optional.of(new TimeRangeAvailability(key.instrumentId(), key.barSpec(), start, end,
            partitions.size(), rows, Timestamps.fromEpochNanos(lastWrittenNs)));
    }
}
