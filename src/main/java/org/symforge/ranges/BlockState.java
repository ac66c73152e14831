package org.symforge.ranges;

import org.symforge.arch.Location;
import org.symforge.arch.RegisterCatalog;
import org.symforge.disasm.BasicBlock;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Per-block dataflow state: the locations each parameter may hold on entry, the ranges recorded by the
 * latest walk and the locations still live at the end of it.
 */
final class BlockState {

    private final BasicBlock block;
    private final List<List<Location>> entry;
    private final List<List<Location>> exit;
    private final List<ObservedRange> observed = new ArrayList<>();
    private int traversalCount;

    BlockState(BasicBlock block, int parameterCount) {
        this.block = block;
        this.entry = new ArrayList<>(parameterCount);
        this.exit = new ArrayList<>(parameterCount);
        for (int i = 0; i < parameterCount; i++) {
            entry.add(new ArrayList<>());
            exit.add(new ArrayList<>());
        }
    }

    BasicBlock block() {
        return block;
    }

    int traversalCount() {
        return traversalCount;
    }

    List<Location> entry(int parameterIndex) {
        return Collections.unmodifiableList(entry.get(parameterIndex));
    }

    List<Location> exit(int parameterIndex) {
        return Collections.unmodifiableList(exit.get(parameterIndex));
    }

    List<ObservedRange> observed() {
        return Collections.unmodifiableList(observed);
    }

    /**
     * Adds an entry location unless an equivalent one is already pending.
     *
     * @return {@code true} if the location is new to this block.
     */
    boolean offer(int parameterIndex, Location location, RegisterCatalog registers) {
        for (Location pending : entry.get(parameterIndex)) {
            if (pending.isEquivalentTo(location, registers)) {
                return false;
            }
        }
        entry.get(parameterIndex).add(location);
        return true;
    }

    /**
     * Starts a new walk, discarding what the previous one recorded.
     *
     * @return The traversal count of the new walk.
     */
    int beginWalk() {
        observed.clear();
        exit.forEach(List::clear);
        return ++traversalCount;
    }

    void record(ObservedRange range) {
        if (!range.isEmpty()) {
            observed.add(range);
        }
    }

    void liveAtExit(int parameterIndex, Location location) {
        exit.get(parameterIndex).add(location);
    }
}
