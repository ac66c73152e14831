package org.symforge.model.index;

import it.unimi.dsi.fastutil.longs.LongArrayList;
import it.unimi.dsi.fastutil.longs.LongList;
import it.unimi.dsi.fastutil.longs.LongLists;

import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Single-address variant of {@link AddressRangeIndex} for symbols that have an address but no size,
 * such as exported names. Supports exact and nearest-at-or-before queries.
 */
public final class AddressPointIndex {

    private final TreeMap<Long, LongArrayList> entries = new TreeMap<>();

    public void insert(long address, long id) {
        entries.computeIfAbsent(address, a -> new LongArrayList()).add(id);
    }

    /**
     * @return {@code true} if the id was registered at the address.
     */
    public boolean remove(long address, long id) {
        LongArrayList ids = entries.get(address);
        if (ids == null || !ids.rem(id)) {
            return false;
        }
        if (ids.isEmpty()) {
            entries.remove(address);
        }
        return true;
    }

    public LongList findAt(long address) {
        LongArrayList ids = entries.get(address);
        return ids == null ? LongLists.EMPTY_LIST : LongLists.unmodifiable(new LongArrayList(ids));
    }

    /**
     * Finds the closest registered address that is less than or equal to {@code address}.
     *
     * @param address The address to look up.
     * @return The nearest entry, or empty if nothing is registered at or below the address.
     */
    public Optional<PointMatch> findNearestAtOrBefore(long address) {
        Map.Entry<Long, LongArrayList> entry = entries.floorEntry(address);
        if (entry == null) {
            return Optional.empty();
        }
        return Optional.of(new PointMatch(entry.getKey(), LongLists.unmodifiable(new LongArrayList(entry.getValue()))));
    }

    public int size() {
        return entries.size();
    }

    /**
     * @param address The registered address.
     * @param ids The ids registered at that address.
     */
    public record PointMatch(long address, LongList ids) {
    }
}
