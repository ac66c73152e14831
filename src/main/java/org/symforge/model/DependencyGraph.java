package org.symforge.model;

import it.unimi.dsi.fastutil.longs.Long2IntLinkedOpenHashMap;
import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.longs.LongArrayList;
import it.unimi.dsi.fastutil.longs.LongList;
import it.unimi.dsi.fastutil.longs.LongLists;

/**
 * Reference-counted "A must recompute when B changes" edges, keyed by dependency then dependent.
 * A dependent registered twice on the same dependency needs two removals before the edge disappears.
 */
public final class DependencyGraph {

    private final Long2ObjectOpenHashMap<Long2IntLinkedOpenHashMap> dependents = new Long2ObjectOpenHashMap<>();

    public void add(long dependencyId, long dependentId) {
        Long2IntLinkedOpenHashMap counts = dependents.get(dependencyId);
        if (counts == null) {
            counts = new Long2IntLinkedOpenHashMap();
            dependents.put(dependencyId, counts);
        }
        counts.addTo(dependentId, 1);
    }

    /**
     * Drops one reference of {@code dependentId} on {@code dependencyId}.
     *
     * @return {@code false} if no such edge existed.
     */
    public boolean remove(long dependencyId, long dependentId) {
        Long2IntLinkedOpenHashMap counts = dependents.get(dependencyId);
        if (counts == null || !counts.containsKey(dependentId)) {
            return false;
        }
        if (counts.get(dependentId) <= 1) {
            counts.remove(dependentId);
            if (counts.isEmpty()) {
                dependents.remove(dependencyId);
            }
        } else {
            counts.addTo(dependentId, -1);
        }
        return true;
    }

    public int count(long dependencyId, long dependentId) {
        Long2IntLinkedOpenHashMap counts = dependents.get(dependencyId);
        return counts == null ? 0 : counts.get(dependentId);
    }

    /**
     * @return A snapshot of the dependents of {@code dependencyId} in registration order.
     */
    public LongList dependentsOf(long dependencyId) {
        Long2IntLinkedOpenHashMap counts = dependents.get(dependencyId);
        return counts == null ? LongLists.EMPTY_LIST : new LongArrayList(counts.keySet());
    }

    /**
     * Forgets every edge pointing at a dependency that will never be notified again.
     */
    void forget(long dependencyId) {
        dependents.remove(dependencyId);
    }
}
