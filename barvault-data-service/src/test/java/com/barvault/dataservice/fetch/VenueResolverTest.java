package com.barvault.dataservice.fetch;

import com.barvault.core.model.InstrumentDescriptor;
import com.barvault.core.model.InstrumentId;
import com.barvault.core.model.Venue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class VenueResolverTest {

    private static final InstrumentId AAPL = InstrumentId.parse("AAPL.NASDAQ");

    @Test
    @DisplayName("Should use the descriptor's venue override first")
    void descriptorOverrideWins() {
        VenueResolver resolver = VenueResolver.standard(Venue.SIM);
        InstrumentDescriptor descriptor = InstrumentDescriptor.equity(AAPL, "USD").withVenue(Venue.of("XNAS"));

        assertEquals(Venue.of("XNAS"), resolver.resolve(AAPL, descriptor));
    }

    @Test
    @DisplayName("Should fall back to the instrument id's venue")
    void instrumentIdVenue() {
        VenueResolver resolver = VenueResolver.standard(Venue.SIM);

        assertEquals(Venue.of("NASDAQ"), resolver.resolve(AAPL, InstrumentDescriptor.equity(AAPL, "USD")));
        assertEquals(Venue.of("NASDAQ"), resolver.resolve(AAPL, null));
    }

    @Test
    @DisplayName("Should use the configured default when no rule matches")
    void defaultVenue() {
        VenueResolver resolver = new VenueResolver(List.of(VenueResolver.DESCRIPTOR_VENUE), Venue.SIM);

        Venue venue = resolver.resolve(AAPL, InstrumentDescriptor.equity(AAPL, "USD"));

        assertEquals(Venue.SIM, venue);
        assertTrue(venue.isSimulation());
    }
}
