package com.barvault.dataservice.fetch;

import com.barvault.core.model.Bar;
import com.barvault.core.model.BarSpec;
import com.barvault.core.model.InstrumentDescriptor;
import com.barvault.core.model.Venue;

import java.util.List;

/**
 * Bars for a request together with the instrument they belong to.
 */
public record FetchResult(
    List<Bar> bars,
    InstrumentDescriptor descriptor,
    Venue venue,
    BarSpec barSpec,
    Source source
) {

    public enum Source {
        /** Served from the store, descriptor already present. */
        CACHE,
        /** Served from the store after fetching the missing descriptor. */
        CACHE_WITH_BACKFILL,
        /** Fetched from the provider and persisted. */
        REMOTE
    }

    public FetchResult {
        bars = List.copyOf(bars);
    }
}
