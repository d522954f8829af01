package com.barvault.dataservice.fetch;

import com.barvault.core.model.InstrumentDescriptor;
import com.barvault.core.model.InstrumentId;
import com.barvault.core.model.Venue;

import java.util.List;
import java.util.Optional;

/**
 * Decides which venue a descriptor/bar pair belongs to by trying an ordered list of rules.
 * The first rule that yields a venue wins; if none does, the fallback venue is used.
 */
public class VenueResolver {

    /**
     * One resolution step. {@code descriptor} may be null.
     */
    @FunctionalInterface
    public interface Rule {
        Optional<Venue> resolve(InstrumentId instrumentId, InstrumentDescriptor descriptor);
    }

    /** Venue override carried by the descriptor. */
    public static final Rule DESCRIPTOR_VENUE = (id, descriptor) ->
        descriptor == null ? Optional.empty() : descriptor.venueOverride();

    /** Venue part of the bar series' instrument id. */
    public static final Rule INSTRUMENT_ID_VENUE = (id, descriptor) ->
        id == null || id.venue().isBlank() ? Optional.empty() : Optional.of(id.venueValue());

    private final List<Rule> rules;
    private final Venue fallback;

    public VenueResolver(List<Rule> rules, Venue fallback) {
        this.rules = List.copyOf(rules);
        this.fallback = fallback;
    }

    /**
     * Descriptor venue, then instrument id venue, then {@code defaultVenue}.
     */
    public static VenueResolver standard(Venue defaultVenue) {
        return new VenueResolver(List.of(DESCRIPTOR_VENUE, INSTRUMENT_ID_VENUE), defaultVenue);
    }

    public Venue resolve(InstrumentId instrumentId, InstrumentDescriptor descriptor) {
        for (Rule rule : rules) {
            Optional<Venue> venue = rule.resolve(instrumentId, descriptor);
            if (venue.isPresent()) {
                return venue.get();
            }
        }
        return fallback;
    }

    public Venue getFallback() {
        return fallback;
    }
}
