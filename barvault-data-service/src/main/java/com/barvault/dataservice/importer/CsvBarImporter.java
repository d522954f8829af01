package com.barvault.dataservice.importer;

import com.barvault.core.model.Bar;
import com.barvault.core.model.BarSpec;
import com.barvault.core.model.BarType;
import com.barvault.core.model.InstrumentId;
import com.barvault.core.model.SeriesKey;
import com.barvault.core.time.Timestamps;
import com.barvault.dataservice.exception.CatalogException;
import com.barvault.dataservice.exception.ValidationException;
import com.barvault.dataservice.index.AvailabilityIndex;
import com.barvault.dataservice.store.ColumnStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Bulk import of OHLCV rows from CSV into the column store.
 *
 * Expected header (any order, extra columns ignored): timestamp,open,high,low,close,volume.
 * Invalid rows are reported in the result and do not stop the rest of the file.
 * Imported bars use aggregation source EXTERNAL.
 */
public class CsvBarImporter {

    private static final Logger log = LoggerFactory.getLogger(CsvBarImporter.class);

    static final List<String> REQUIRED_COLUMNS = List.of("timestamp", "open", "high", "low", "close", "volume");

    private final ColumnStore store;
    private final AvailabilityIndex index;
    private final ConflictPolicy policy;
    private final Clock clock;

    public CsvBarImporter(ColumnStore store, AvailabilityIndex index, ConflictPolicy policy) {
        this(store, index, policy, Clock.systemUTC());
    }

    public CsvBarImporter(ColumnStore store, AvailabilityIndex index, ConflictPolicy policy, Clock clock) {
        this.store = store;
        this.index = index;
        this.policy = policy;
        this.clock = clock;
    }

    /**
     * @throws ValidationException (row 0) if the header lacks a required column
     * @throws IOException         if the file cannot be read
     * @throws CatalogException    if writing to the store fails
     */
    public ImportResult importFile(Path file, InstrumentId instrumentId, BarSpec barSpec)
            throws IOException, CatalogException {
        if (!Files.isRegularFile(file)) {
            throw new NoSuchFileException(file.toString(), null, "CSV file not found");
        }
        log.info("Importing {} as {} {} (policy {})", file, instrumentId, barSpec, policy);

        BarType barType = BarType.external(instrumentId, barSpec);
        long ingestNs = Timestamps.toEpochNanos(clock.instant());
        List<String> errors = new ArrayList<>();
        TreeMap<Long, Bar> bars = new TreeMap<>();
        int rowsProcessed = 0;

        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String headerLine = reader.readLine();
            if (headerLine == null) {
                throw new ValidationException(0, "File is empty");
            }
            Map<String, Integer> columns = parseHeader(headerLine);

            String line;
            int rowNumber = 1;
            while ((line = reader.readLine()) != null) {
                rowNumber++;
                if (line.isBlank()) {
                    continue;
                }
                rowsProcessed++;
                try {
                    Bar bar = parseRow(line, rowNumber, columns, barType, ingestNs);
                    if (bars.putIfAbsent(bar.eventTimeNs(), bar) != null) {
                        throw new ValidationException(rowNumber, "Duplicate timestamp " + bar.eventTime());
                    }
                } catch (ValidationException e) {
                    errors.add(e.getMessage());
                }
            }
        }

        if (bars.isEmpty()) {
            log.warn("No valid rows in {} ({} errors)", file, errors.size());
            return new ImportResult(file, instrumentId, barSpec, policy, rowsProcessed, 0, 0, errors, null, null);
        }

        List<Bar> batch = new ArrayList<>(bars.values());
        Instant first = batch.get(0).eventTime();
        Instant last = batch.get(batch.size() - 1).eventTime();
        SeriesKey key = barType.seriesKey();

        int written = 0;
        int skipped = 0;
        switch (policy) {
            case SKIP -> {
                if (index.overlapsRange(key, first, last)) {
                    log.info("Skipping import for {}: stored data overlaps [{}, {}]", key, first, last);
                    skipped = batch.size();
                } else {
                    written = writeBatch(batch, instrumentId, key);
                }
            }
            case OVERWRITE -> {
                store.deletePartitions(barType, first, last);
                written = writeBatch(batch, instrumentId, key);
            }
            case MERGE -> written = writeBatch(batch, instrumentId, key);
        }

        log.info("Import of {} done: {} rows, {} written, {} skipped, {} errors",
            file.getFileName(), rowsProcessed, written, skipped, errors.size());
        return new ImportResult(file, instrumentId, barSpec, policy, rowsProcessed, written, skipped,
            errors, first, last);
    }

    private int writeBatch(List<Bar> batch, InstrumentId instrumentId, SeriesKey key) throws CatalogException {
        store.write(batch, "csv-import-" + instrumentId.symbol());
        index.refresh(store, key);
        return batch.size();
    }

    private static Map<String, Integer> parseHeader(String headerLine) throws ValidationException {
        String[] names = headerLine.split(",");
        Map<String, Integer> columns = new HashMap<>();
        for (int i = 0; i < names.length; i++) {
            columns.put(names[i].trim().toLowerCase(Locale.ROOT), i);
        }
        List<String> missing = REQUIRED_COLUMNS.stream().filter(c -> !columns.containsKey(c)).toList();
        if (!missing.isEmpty()) {
            throw new ValidationException(0, "Missing required columns: " + missing);
        }
        return columns;
    }

    private static Bar parseRow(String line, int rowNumber, Map<String, Integer> columns,
                                BarType barType, long ingestNs) throws ValidationException {
        String[] fields = line.split(",", -1);
        if (fields.length < columns.size()) {
            throw new ValidationException(rowNumber, "Expected " + columns.size() + " columns, got " + fields.length);
        }

        Instant timestamp;
        String rawTimestamp = field(fields, columns, "timestamp");
        try {
            timestamp = Timestamps.parse(rawTimestamp);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(rowNumber, "Invalid timestamp format: " + rawTimestamp);
        }

        BigDecimal open = price(fields, columns, "open", rowNumber);
        BigDecimal high = price(fields, columns, "high", rowNumber);
        BigDecimal low = price(fields, columns, "low", rowNumber);
        BigDecimal close = price(fields, columns, "close", rowNumber);

        long volume;
        String rawVolume = field(fields, columns, "volume");
        try {
            volume = new BigDecimal(rawVolume).longValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            throw new ValidationException(rowNumber, "Invalid volume: " + rawVolume);
        }
        if (volume < 0) {
            throw new ValidationException(rowNumber, "volume must be >= 0, got " + volume);
        }

        if (high.compareTo(low) < 0) {
            throw new ValidationException(rowNumber, "high (" + high + ") must be >= low (" + low + ")");
        }
        if (high.compareTo(open) < 0) {
            throw new ValidationException(rowNumber, "high (" + high + ") must be >= open (" + open + ")");
        }
        if (high.compareTo(close) < 0) {
            throw new ValidationException(rowNumber, "high (" + high + ") must be >= close (" + close + ")");
        }
        if (low.compareTo(open) > 0) {
            throw new ValidationException(rowNumber, "low (" + low + ") must be <= open (" + open + ")");
        }
        if (low.compareTo(close) > 0) {
            throw new ValidationException(rowNumber, "low (" + low + ") must be <= close (" + close + ")");
        }

        // All four prices share the finest precision seen in the row
        int scale = Math.max(Math.max(open.scale(), high.scale()), Math.max(low.scale(), close.scale()));
        scale = Math.max(scale, 0);
        return new Bar(barType, open.setScale(scale), high.setScale(scale), low.setScale(scale),
            close.setScale(scale), volume, Timestamps.toEpochNanos(timestamp), ingestNs);
    }

    private static BigDecimal price(String[] fields, Map<String, Integer> columns, String name, int rowNumber)
            throws ValidationException {
        String raw = field(fields, columns, name);
        BigDecimal value;
        try {
            value = new BigDecimal(raw);
        } catch (NumberFormatException e) {
            throw new ValidationException(rowNumber, "Invalid " + name + ": " + raw);
        }
        if (value.signum() <= 0) {
            throw new ValidationException(rowNumber, name + " must be > 0, got " + raw);
        }
        return value;
    }

    private static String field(String[] fields, Map<String, Integer> columns, String name) {
        return fields[columns.get(name)].trim();
    }
}
