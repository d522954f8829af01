package com.barvault.dataservice.importer;

import com.barvault.core.model.BarSpec;
import com.barvault.core.model.InstrumentId;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * Outcome of importing one CSV file.
 *
 * @param rowsProcessed     data rows read, excluding the header
 * @param validationErrors  one "Row N: reason" entry per rejected row
 * @param firstEvent        earliest valid bar, null when no row was valid
 * @param lastEvent         latest valid bar, null when no row was valid
 */
public record ImportResult(
    Path file,
    InstrumentId instrumentId,
    BarSpec barSpec,
    ConflictPolicy policy,
    int rowsProcessed,
    int barsWritten,
    int conflictsSkipped,
    List<String> validationErrors,
    Instant firstEvent,
    Instant lastEvent
) {

    public ImportResult {
        validationErrors = List.copyOf(validationErrors);
    }

    public boolean hasErrors() {
        return !validationErrors.isEmpty();
    }

    public String dateRange() {
        return firstEvent == null ? "N/A" : firstEvent + " to " + lastEvent;
    }
}
