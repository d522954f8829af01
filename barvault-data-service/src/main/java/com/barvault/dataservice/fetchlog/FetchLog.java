package com.barvault.dataservice.fetchlog;

import com.barvault.dataservice.fetch.FetchRequest;

/**
 * Receives every fetch request state change. Implementations must not throw.
 */
@FunctionalInterface
public interface FetchLog {

    FetchLog NONE = request -> { };

    void record(FetchRequest request);
}
