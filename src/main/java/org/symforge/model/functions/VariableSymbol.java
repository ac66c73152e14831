package org.symforge.model.functions;

import org.symforge.arch.Location;
import org.symforge.model.HasType;
import org.symforge.model.Symbol;
import org.symforge.model.SymbolException;
import org.symforge.model.SymbolKind;
import org.symforge.model.SymbolStore;
import org.symforge.model.types.TypeSymbol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A parameter or local of a function, with the live ranges that say where it is stored at each point
 * of the function's code. Ranges of one variable never overlap.
 */
public class VariableSymbol extends Symbol implements HasType {

    private final List<LiveRange> liveRanges = new ArrayList<>();
    private long typeId;
    private long nextRangeId = 0;

    public VariableSymbol(SymbolKind kind, long functionId, String name, long typeId) {
        super(kind, functionId, name, null);
        if (kind != SymbolKind.PARAMETER && kind != SymbolKind.LOCAL) {
            throw SymbolException.invalidArgument("Variable kind must be PARAMETER or LOCAL, not %s", kind);
        }
        if (name == null || name.isBlank()) {
            throw SymbolException.invalidArgument("Variable requires a name");
        }
        this.typeId = typeId;
    }

    @Override
    protected void validate(SymbolStore store) {
        if (!(store.require(parentId()) instanceof FunctionSymbol)) {
            throw SymbolException.invalidArgument("Owner %d of variable '%s' is not a function", parentId(), name());
        }
        requireType(store, typeId);
    }

    @Override
    protected void onAttach() {
        store().addDependentNotify(id(), parentId());
    }

    @Override
    protected void onDelete() {
        store().removeDependentNotify(id(), parentId());
    }

    @Override
    public long typeId() {
        return typeId;
    }

    public boolean isParameter() {
        return kind() == SymbolKind.PARAMETER;
    }

    public void setType(long newTypeId) {
        requireType(store(), newTypeId);
        typeId = newTypeId;
        changed();
    }

    /**
     * Moves this parameter before the parameter at {@code position}.
     */
    public void moveToBefore(long position) {
        if (!isParameter()) {
            throw SymbolException.invalidArgument("Only parameters can be reordered; '%s' is a local", name());
        }
        store().moveChildBefore(parentId(), id(), position, SymbolKind.PARAMETER);
    }

    // region Live ranges

    /**
     * @return The live ranges ordered by offset.
     */
    public List<LiveRange> liveRanges() {
        List<LiveRange> sorted = new ArrayList<>(liveRanges);
        sorted.sort(Comparator.comparingLong(LiveRange::offset));
        return Collections.unmodifiableList(sorted);
    }

    public Optional<LiveRange> findLiveRange(long rangeId) {
        return liveRanges.stream().filter(r -> r.id() == rangeId).findFirst();
    }

    /**
     * @return The live range covering a function-relative offset, if any.
     */
    public Optional<LiveRange> liveRangeAt(long functionOffset) {
        return liveRanges.stream().filter(r -> r.covers(functionOffset)).findFirst();
    }

    /**
     * Adds a live range.
     *
     * @param offset The function-relative start offset.
     * @param size The size in bytes.
     * @param location Where the variable lives over the range.
     * @return The id of the new range.
     * @throws SymbolException {@code INVALID_ARGUMENT} if the range leaves the function or overlaps
     *                         another range of this variable.
     */
    public long addLiveRange(long offset, long size, Location location) {
        Objects.requireNonNull(location, "location");
        validateLiveRange(0, offset, size);
        long rangeId = ++nextRangeId;
        liveRanges.add(new LiveRange(rangeId, offset, size, location));
        store().invalidateExternalCaches();
        return rangeId;
    }

    public void setLiveRangeOffset(long rangeId, long offset) {
        LiveRange range = requireLiveRange(rangeId);
        validateLiveRange(rangeId, offset, range.size());
        replace(range, range.withOffset(offset));
    }

    public void setLiveRangeSize(long rangeId, long size) {
        LiveRange range = requireLiveRange(rangeId);
        validateLiveRange(rangeId, range.offset(), size);
        replace(range, range.withSize(size));
    }

    public void setLiveRangeLocation(long rangeId, Location location) {
        Objects.requireNonNull(location, "location");
        LiveRange range = requireLiveRange(rangeId);
        replace(range, range.withLocation(location));
    }

    public void deleteLiveRange(long rangeId) {
        liveRanges.remove(requireLiveRange(rangeId));
        store().invalidateExternalCaches();
    }

    public void deleteAllLiveRanges() {
        liveRanges.clear();
        store().invalidateExternalCaches();
    }

    // endregion

    // region Locations

    /**
     * Returns the variable's location independent of any scope. This is only defined when the variable has
     * a single live range covering the whole of a single-range function.
     *
     * @throws SymbolException {@code NOT_FOUND} if no such scope-independent location exists.
     */
    public Location unboundLocation() {
        FunctionSymbol function = store().resolveReference(parentId(), FunctionSymbol.class);
        List<AddressRange> ranges = function.ranges();
        if (ranges.size() == 1 && liveRanges.size() == 1) {
            LiveRange only = liveRanges.get(0);
            if (only.offset() == 0 && only.size() == ranges.get(0).size()) {
                return only.location();
            }
        }
        throw SymbolException.notFound("Variable '%s' has no scope independent location", name());
    }

    /**
     * @return The location at a function-relative offset, or {@link Location#none()} if not live there.
     */
    public Location locationAt(long functionOffset) {
        return liveRangeAt(functionOffset).map(LiveRange::location).orElse(Location.none());
    }

    // endregion

    private void validateLiveRange(long ignoredRangeId, long offset, long size) {
        if (size <= 0) {
            throw SymbolException.invalidArgument("Live range size must be positive: %d", size);
        }
        FunctionSymbol function = store().resolveReference(parentId(), FunctionSymbol.class);
        List<AddressRange> relative = function.relativeRanges();
        if (relative.isEmpty()) {
            throw SymbolException.invalidArgument("Function '%s' has no address ranges", function.name());
        }
        boolean inside = relative.stream().anyMatch(r -> r.contains(offset, size));
        if (!inside) {
            throw SymbolException.invalidArgument("Live range [%#x, +%#x) of '%s' is not within a single range of '%s'",
                    offset, size, name(), function.name());
        }
        for (LiveRange other : liveRanges) {
            if (other.id() != ignoredRangeId && offset < other.end() && other.offset() < offset + size) {
                throw SymbolException.invalidArgument("Live range [%#x, +%#x) of '%s' overlaps range %d",
                        offset, size, name(), other.id());
            }
        }
    }

    private LiveRange requireLiveRange(long rangeId) {
        return findLiveRange(rangeId)
                .orElseThrow(() -> SymbolException.notFound("Variable '%s' has no live range %d", name(), rangeId));
    }

    private void replace(LiveRange oldRange, LiveRange newRange) {
        liveRanges.set(liveRanges.indexOf(oldRange), newRange);
        store().invalidateExternalCaches();
    }

    private static void requireType(SymbolStore store, long id) {
        if (!(store.require(id) instanceof TypeSymbol)) {
            throw SymbolException.invalidArgument("Symbol %d is not a type", id);
        }
    }
}
