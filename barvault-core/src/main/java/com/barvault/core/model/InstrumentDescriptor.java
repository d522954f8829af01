package com.barvault.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Static identity and trading metadata for an instrument.
 *
 * @param venue explicit venue override, or null to use the instrument id's venue
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record InstrumentDescriptor(
    InstrumentId instrumentId,
    AssetClass assetClass,
    String quoteCurrency,
    int pricePrecision,
    BigDecimal tickSize,
    BigDecimal lotSize,
    BigDecimal multiplier,
    String description,
    Venue venue
) {

    public InstrumentDescriptor {
        if (instrumentId == null) {
            throw new IllegalArgumentException("instrumentId is required");
        }
        if (assetClass == null) {
            throw new IllegalArgumentException("assetClass is required");
        }
        if (pricePrecision < 0) {
            throw new IllegalArgumentException("pricePrecision must be >= 0");
        }
        if (quoteCurrency == null) {
            quoteCurrency = "USD";
        }
        if (tickSize == null) {
            tickSize = BigDecimal.ONE.movePointLeft(pricePrecision);
        }
        if (lotSize == null) {
            lotSize = BigDecimal.ONE;
        }
        if (multiplier == null) {
            multiplier = BigDecimal.ONE;
        }
    }

    /**
     * Plain cash equity with two-decimal prices.
     */
    public static InstrumentDescriptor equity(InstrumentId instrumentId, String quoteCurrency) {
        return new InstrumentDescriptor(instrumentId, AssetClass.EQUITY, quoteCurrency, 2,
            new BigDecimal("0.01"), BigDecimal.ONE, BigDecimal.ONE, instrumentId.symbol(), null);
    }

    public Optional<Venue> venueOverride() {
        return Optional.ofNullable(venue);
    }

    public InstrumentDescriptor withVenue(Venue newVenue) {
        return new InstrumentDescriptor(instrumentId, assetClass, quoteCurrency, pricePrecision,
            tickSize, lotSize, multiplier, description, newVenue);
    }
}
