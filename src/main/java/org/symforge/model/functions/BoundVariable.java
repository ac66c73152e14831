package org.symforge.model.functions;

import org.symforge.arch.Location;
import org.symforge.model.SymbolKind;

import java.util.List;

/**
 * A parameter or local as seen from one scope instance: a snapshot of the variable together with the
 * location it occupies at the scope's offset. Each scope builds its own views.
 *
 * @param variableId The id of the variable.
 * @param kind {@link SymbolKind#PARAMETER} or {@link SymbolKind#LOCAL}.
 * @param name The variable name.
 * @param typeId The variable type.
 * @param location The location at the scope offset, {@link Location#none()} when not live there.
 * @param liveRanges All live ranges of the variable at the time the view was taken.
 */
public record BoundVariable(long variableId, SymbolKind kind, String name, long typeId, Location location,
                            List<LiveRange> liveRanges) {

    public BoundVariable {
        liveRanges = List.copyOf(liveRanges);
    }

    static BoundVariable bind(VariableSymbol variable, long functionOffset) {
        return new BoundVariable(variable.id(), variable.kind(), variable.name(), variable.typeId(),
                variable.locationAt(functionOffset), variable.liveRanges());
    }

    public boolean isLive() {
        return !location.isNone();
    }
}
