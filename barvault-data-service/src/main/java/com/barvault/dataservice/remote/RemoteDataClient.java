package com.barvault.dataservice.remote;

import com.barvault.core.model.BarSpec;
import com.barvault.core.model.InstrumentDescriptor;
import com.barvault.core.model.InstrumentId;
import com.barvault.dataservice.exception.CatalogException;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;

/**
 * Remote market-data provider. Connection settings belong to the implementation.
 *
 * Errors are reported as {@link com.barvault.dataservice.exception.RateLimitExceededException}
 * for quota rejections, {@link com.barvault.dataservice.exception.RemoteDataException} flagged
 * retryable or fatal for provider errors, and {@link IOException} for transport failures.
 */
public interface RemoteDataClient {

    /**
     * Bars with event time in [start, end] plus the instrument's descriptor.
     */
    RemoteBars fetchBars(InstrumentId instrumentId, BarSpec barSpec, Instant start, Instant end)
        throws CatalogException, IOException;

    /**
     * Descriptor only, without any bars.
     */
    InstrumentDescriptor fetchDescriptor(InstrumentId instrumentId) throws CatalogException, IOException;

    boolean isConnected();

    /**
     * Establish the connection, waiting at most {@code timeout}.
     *
     * @throws com.barvault.dataservice.exception.ProviderUnavailableException if it cannot be reached
     */
    void connect(Duration timeout) throws CatalogException;
}
