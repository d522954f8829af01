package com.barvault.dataservice.importer;

import java.util.Locale;

/**
 * What a bulk import does when the incoming range overlaps stored partitions.
 */
public enum ConflictPolicy {
    /** Leave stored data alone and drop the whole batch. */
    SKIP,
    /** Delete overlapping partitions, then write. */
    OVERWRITE,
    /** Write alongside; reads de-duplicate with the import taking precedence. */
    MERGE;

    public static ConflictPolicy parse(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new IllegalArgumentException("Invalid conflict policy: " + value
                + " (expected skip, overwrite or merge)", e);
        }
    }
}
