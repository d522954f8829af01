package com.barvault.dataservice.remote;

import com.barvault.core.model.Bar;
import com.barvault.core.model.InstrumentDescriptor;

import java.util.List;

/**
 * One successful fetch: the bars and the descriptor of the instrument they belong to.
 */
public record RemoteBars(List<Bar> bars, InstrumentDescriptor descriptor) {

    public RemoteBars {
        bars = bars == null ? List.of() : List.copyOf(bars);
    }

    public boolean isEmpty() {
        return bars.isEmpty();
    }
}
