package com.barvault.core.model;

/**
 * Where a bar series was aggregated: by the data provider (EXTERNAL) or locally (INTERNAL).
 */
public enum AggregationSource {
    EXTERNAL,
    INTERNAL
}
