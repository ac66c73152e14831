package org.symforge.api;

import org.symforge.model.SymbolKind;
import org.symforge.model.functions.LiveRange;

import java.util.List;

/**
 * A parameter or local with its live ranges, ordered by offset.
 */
public record VariableInfo(long id, SymbolKind kind, long functionId, String name, long typeId, List<LiveRange> liveRanges) {

    public VariableInfo {
        liveRanges = List.copyOf(liveRanges);
    }
}
