package com.barvault.dataservice.store;

import com.barvault.core.model.AggregationSource;
import com.barvault.core.model.Bar;
import com.barvault.core.model.BarSpec;
import com.barvault.core.model.BarType;
import com.barvault.core.model.InstrumentDescriptor;
import com.barvault.core.model.InstrumentId;
import com.barvault.core.time.Timestamps;
import com.barvault.dataservice.exception.CatalogCorruptionException;
import com.barvault.dataservice.exception.CatalogException;
import com.barvault.dataservice.store.PartitionCodec.PartitionContent;
import com.barvault.dataservice.store.PartitionCodec.PartitionHeader;
import com.barvault.dataservice.store.PartitionNaming.FileRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Stream;

/**
 * Partitioned bar store plus instrument descriptors.
 *
 * Directory structure:
 * - {root}/data/bar/{barType}/{start}Z_{end}Z.bvc - one file per fetch or import batch
 * - {root}/data/instrument/{instrumentId}.json
 *
 * Files are never modified in place. Overlapping partitions are allowed; reads merge them
 * and the most recently written file wins for a given event time. Writers are serialized
 * by a store-level lock, readers need no locking since files are replaced atomically.
 */
public class ColumnStore {

    private static final Logger log = LoggerFactory.getLogger(ColumnStore.class);

    private final Path root;
    private final Path barDir;
    private final InstrumentStore instrumentStore;
    private final PartitionCodec codec;
    private final Clock clock;
    private final ReentrantLock writeLock = new ReentrantLock();
    private long lastWrittenAtNs;

    public ColumnStore(Path root) {
        this(root, Clock.systemUTC());
    }

    public ColumnStore(Path root, Clock clock) {
        this.root = root;
        this.barDir = root.resolve("data").resolve("bar");
        this.instrumentStore = new InstrumentStore(root.resolve("data").resolve("instrument"));
        this.codec = new PartitionCodec();
        this.clock = clock;
    }

    public Path getRoot() {
        return root;
    }

    public Path getBarDirectory() {
        return barDir;
    }

    public InstrumentStore getInstrumentStore() {
        return instrumentStore;
    }

    // ========== Writes ==========

    /**
     * Write a batch whose covered window is its first and last event time.
     */
    public PartitionMeta write(List<Bar> bars, String correlationId) throws CatalogException {
        if (bars == null || bars.isEmpty()) {
            throw new IllegalArgumentException("Cannot write an empty batch");
        }
        List<Bar> sorted = sortedCopy(bars);
        return write(sorted, sorted.get(0).eventTime(), sorted.get(sorted.size() - 1).eventTime(), correlationId);
    }

    /**
     * Write a batch as one new partition covering [coveredStart, coveredEnd].
     * The covered window is what a fetch asked for, which may extend past the bars
     * themselves (a one-hour minute request yields bars up to 59 minutes in).
     * If a partition with the same window already exists, the two are merged
     * with this batch taking precedence.
     */
    public PartitionMeta write(List<Bar> bars, Instant coveredStart, Instant coveredEnd,
                               String correlationId) throws CatalogException {
        if (bars == null || bars.isEmpty()) {
            throw new IllegalArgumentException("Cannot write an empty batch");
        }
        List<Bar> sorted = sortedCopy(bars);
        Bar.validateSeries(sorted);
        Instant first = sorted.get(0).eventTime();
        Instant last = sorted.get(sorted.size() - 1).eventTime();
        if (first.isBefore(coveredStart) || last.isAfter(coveredEnd)) {
            throw new IllegalArgumentException("Bars [" + first + ", " + last
                + "] fall outside covered window [" + coveredStart + ", " + coveredEnd + "]");
        }

        BarType barType = sorted.get(0).barType();
        Path dir = barDir.resolve(PartitionNaming.directoryName(barType));
        Path target = dir.resolve(PartitionNaming.fileName(coveredStart, coveredEnd));

        writeLock.lock();
        try {
            List<Bar> toWrite = sorted;
            if (Files.exists(target)) {
                toWrite = mergeWithExisting(target, sorted);
                log.debug("[{}] Merging into existing partition {}", correlationId, target.getFileName());
            }

            long writtenAtNs = nextWrittenAt();
            Files.createDirectories(dir);
            AtomicFiles.write(target, codec.encode(barType, toWrite, writtenAtNs));

            log.info("[{}] Wrote {} bars for {} to {}", correlationId, toWrite.size(), barType, target.getFileName());
            return new PartitionMeta(barType, target, coveredStart, coveredEnd,
                Files.size(target), toWrite.size(), writtenAtNs);
        } catch (IOException e) {
            log.error("[{}] Write failed for {}: {}", correlationId, barType, e.getMessage());
            throw new CatalogException("Write failed for " + barType + ": " + e.getMessage(), e);
        } finally {
            writeLock.unlock();
        }
    }

    public void write(InstrumentDescriptor descriptor) throws CatalogException {
        writeLock.lock();
        try {
            instrumentStore.save(descriptor);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Delete every partition of a bar type whose window overlaps [start, end].
     *
     * @return number of files deleted
     */
    public int deletePartitions(BarType barType, Instant start, Instant end) throws CatalogException {
        Path dir = barDir.resolve(PartitionNaming.directoryName(barType));
        writeLock.lock();
        try {
            int deleted = 0;
            for (Path file : partitionFiles(dir)) {
                FileRange range;
                try {
                    range = PartitionNaming.parseFileName(file.getFileName().toString());
                } catch (IllegalArgumentException e) {
                    continue;
                }
                if (range.intersects(start, end)) {
                    Files.delete(file);
                    deleted++;
                }
            }
            if (deleted > 0) {
                log.info("Deleted {} partitions of {} overlapping [{}, {}]", deleted, barType, start, end);
            }
            return deleted;
        } catch (IOException e) {
            throw new CatalogException("Delete failed for " + barType + ": " + e.getMessage(), e);
        } finally {
            writeLock.unlock();
        }
    }

    // ========== Reads ==========

    /**
     * Bars of one series with event time in [start, end], sorted and de-duplicated.
     * Both aggregation sources are merged. Returns an empty list when nothing is stored.
     *
     * @throws CatalogCorruptionException if an intersecting file cannot be decoded
     */
    public List<Bar> query(InstrumentId instrumentId, BarSpec barSpec, Instant start, Instant end)
            throws CatalogException {
        long startNs = Timestamps.toEpochNanos(start);
        long endNs = Timestamps.toEpochNanos(end);

        List<PartitionContent> contents = new ArrayList<>();
        for (AggregationSource source : AggregationSource.values()) {
            Path dir = barDir.resolve(PartitionNaming.directoryName(new BarType(instrumentId, barSpec, source)));
            for (Path file : partitionFiles(dir)) {
                FileRange range;
                try {
                    range = PartitionNaming.parseFileName(file.getFileName().toString());
                } catch (IllegalArgumentException e) {
                    log.warn("Skipping unparsable partition name {}", file);
                    continue;
                }
                if (!range.intersects(start, end)) {
                    continue;
                }
                try {
                    contents.add(codec.read(file));
                } catch (IOException e) {
                    throw new CatalogCorruptionException(file, e);
                }
            }
        }

        // Oldest first so newer files overwrite duplicates
        contents.sort(Comparator.comparingLong(c -> c.header().writtenAtNs()));
        TreeMap<Long, Bar> merged = new TreeMap<>();
        for (PartitionContent content : contents) {
            for (Bar bar : content.bars()) {
                if (bar.eventTimeNs() >= startNs && bar.eventTimeNs() <= endNs) {
                    merged.put(bar.eventTimeNs(), bar);
                }
            }
        }

        log.debug("Query {} {} [{}, {}] -> {} bars from {} files",
            instrumentId, barSpec, start, end, merged.size(), contents.size());
        return new ArrayList<>(merged.values());
    }

    public Optional<InstrumentDescriptor> loadDescriptor(InstrumentId instrumentId) throws CatalogException {
        return instrumentStore.load(instrumentId);
    }

    /**
     * Every readable partition under the bar directory. Directories and files whose names
     * or headers cannot be parsed are logged and skipped.
     */
    public List<PartitionMeta> scanPartitions() {
        List<PartitionMeta> result = new ArrayList<>();
        if (!Files.isDirectory(barDir)) {
            return result;
        }
        List<Path> dirs;
        try (Stream<Path> stream = Files.list(barDir)) {
            dirs = stream.filter(Files::isDirectory).sorted().toList();
        } catch (IOException e) {
            log.warn("Failed to list {}: {}", barDir, e.getMessage());
            return result;
        }

        for (Path dir : dirs) {
            BarType barType;
            try {
                barType = PartitionNaming.parseDirectoryName(dir.getFileName().toString());
            } catch (IllegalArgumentException e) {
                log.warn("Skipping unparsable partition directory {}: {}", dir, e.getMessage());
                continue;
            }
            result.addAll(scanDirectory(barType, dir));
        }
        log.debug("Scanned {} partitions under {}", result.size(), barDir);
        return result;
    }

    public List<PartitionMeta> listPartitions(BarType barType) {
        return scanDirectory(barType, barDir.resolve(PartitionNaming.directoryName(barType)));
    }

    // ========== Internals ==========

    private List<PartitionMeta> scanDirectory(BarType barType, Path dir) {
        List<PartitionMeta> result = new ArrayList<>();
        List<Path> files;
        try {
            files = partitionFiles(dir);
        } catch (CatalogException e) {
            log.warn("Failed to list {}: {}", dir, e.getMessage());
            return result;
        }
        for (Path file : files) {
            try {
                FileRange range;
                try {
                    range = PartitionNaming.parseFileName(file.getFileName().toString());
                } catch (IllegalArgumentException e) {
                    throw new CatalogCorruptionException(file, e.getMessage());
                }
                PartitionHeader header;
                try {
                    header = codec.readHeader(file);
                } catch (IOException e) {
                    throw new CatalogCorruptionException(file, e);
                }
                result.add(new PartitionMeta(barType, file, range.start(), range.end(),
                    Files.size(file), header.rowCount(), header.writtenAtNs()));
            } catch (CatalogCorruptionException e) {
                log.warn("Skipping partition: {}", e.getMessage());
            } catch (IOException e) {
                log.warn("Skipping partition {}: {}", file, e.getMessage());
            }
        }
        return result;
    }

    private List<Path> partitionFiles(Path dir) throws CatalogException {
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> stream = Files.list(dir)) {
            return stream
                .filter(Files::isRegularFile)
                .filter(f -> PartitionNaming.isPartitionFile(f.getFileName().toString()))
                .sorted()
                .toList();
        } catch (IOException e) {
            throw new CatalogException("Failed to list " + dir + ": " + e.getMessage(), e);
        }
    }

    private List<Bar> mergeWithExisting(Path target, List<Bar> incoming) throws CatalogCorruptionException {
        PartitionContent existing;
        try {
            existing = codec.read(target);
        } catch (IOException e) {
            throw new CatalogCorruptionException(target, e);
        }
        TreeMap<Long, Bar> merged = new TreeMap<>();
        for (Bar bar : existing.bars()) {
            merged.put(bar.eventTimeNs(), bar);
        }
        for (Bar bar : incoming) {
            merged.put(bar.eventTimeNs(), bar);
        }
        return new ArrayList<>(merged.values());
    }

    private long nextWrittenAt() {
        long now = Timestamps.toEpochNanos(clock.instant());
        lastWrittenAtNs = Math.max(now, lastWrittenAtNs + 1);
        return lastWrittenAtNs;
    }

    private static List<Bar> sortedCopy(List<Bar> bars) {
        List<Bar> sorted = new ArrayList<>(bars);
        sorted.sort(Comparator.comparingLong(Bar::eventTimeNs));
        return sorted;
    }
}
