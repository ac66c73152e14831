package org.symforge.ranges;

import org.symforge.arch.RegisterCatalog;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.TreeSet;

/**
 * Turns the ranges observed for one parameter across all blocks into disjoint ranges.
 * <p>
 * Ranges recorded on the same traversal count at an equivalent location are coalesced when they overlap
 * or touch. Where incompatible ranges still overlap, the one ending soonest keeps the overlap and the
 * others are cut around it; every range cut this way counts as a deferred split. Pieces that end up
 * adjacent at an equivalent location are joined.
 */
final class RangeMerger {

    private static final Comparator<ObservedRange> BY_START =
            Comparator.comparingLong(ObservedRange::start).thenComparingLong(ObservedRange::end);

    private final RegisterCatalog registers;
    private int deferredSplits;

    RangeMerger(RegisterCatalog registers) {
        this.registers = registers;
    }

    int deferredSplits() {
        return deferredSplits;
    }

    /**
     * @param observed The ranges of one parameter in block address order.
     * @return Disjoint ranges ordered by start address.
     */
    List<ObservedRange> merge(List<ObservedRange> observed) {
        return resolveOverlaps(coalesce(observed));
    }

    private boolean compatible(ObservedRange a, ObservedRange b) {
        return a.traversal() == b.traversal() && a.location().isEquivalentTo(b.location(), registers);
    }

    private List<ObservedRange> coalesce(List<ObservedRange> observed) {
        List<List<ObservedRange>> classes = new ArrayList<>();
        for (ObservedRange range : observed) {
            List<ObservedRange> target = null;
            for (List<ObservedRange> candidate : classes) {
                if (compatible(candidate.get(0), range)) {
                    target = candidate;
                    break;
                }
            }
            if (target == null) {
                target = new ArrayList<>();
                classes.add(target);
            }
            target.add(range);
        }

        List<ObservedRange> result = new ArrayList<>();
        for (List<ObservedRange> members : classes) {
            members.sort(BY_START);
            ObservedRange current = members.get(0);
            for (int i = 1; i < members.size(); i++) {
                ObservedRange next = members.get(i);
                if (next.start() <= current.end()) {
                    current = current.withEnd(Math.max(current.end(), next.end()));
                } else {
                    result.add(current);
                    current = next;
                }
            }
            result.add(current);
        }
        result.sort(BY_START);
        return result;
    }

    private List<ObservedRange> resolveOverlaps(List<ObservedRange> ranges) {
        TreeSet<Long> bounds = new TreeSet<>();
        for (ObservedRange range : ranges) {
            bounds.add(range.start());
            bounds.add(range.end());
        }
        List<Long> points = new ArrayList<>(bounds);
        long[] emitted = new long[ranges.size()];

        List<ObservedRange> result = new ArrayList<>();
        int runOwner = -1;
        long runStart = 0;
        long runEnd = 0;
        for (int i = 0; i + 1 < points.size(); i++) {
            long from = points.get(i);
            long to = points.get(i + 1);
            int owner = soonestEndingCovering(ranges, from, to);
            if (owner < 0) {
                continue;
            }
            emitted[owner] += to - from;
            if (owner == runOwner && runEnd == from) {
                runEnd = to;
                continue;
            }
            if (runOwner >= 0) {
                append(result, ranges.get(runOwner).withStart(runStart).withEnd(runEnd));
            }
            runOwner = owner;
            runStart = from;
            runEnd = to;
        }
        if (runOwner >= 0) {
            append(result, ranges.get(runOwner).withStart(runStart).withEnd(runEnd));
        }

        for (int i = 0; i < ranges.size(); i++) {
            if (emitted[i] != ranges.get(i).size()) {
                deferredSplits++;
            }
        }
        return result;
    }

    /**
     * Adds a piece to the result, joining it to the previous piece when they touch at an equivalent
     * location. Pieces from different traversals of a loop end up here side by side.
     */
    private void append(List<ObservedRange> result, ObservedRange piece) {
        if (!result.isEmpty()) {
            ObservedRange last = result.get(result.size() - 1);
            if (last.end() == piece.start() && last.location().isEquivalentTo(piece.location(), registers)) {
                result.set(result.size() - 1, last.withEnd(piece.end()));
                return;
            }
        }
        result.add(piece);
    }

    private static int soonestEndingCovering(List<ObservedRange> ranges, long from, long to) {
        int best = -1;
        for (int i = 0; i < ranges.size(); i++) {
            ObservedRange range = ranges.get(i);
            if (range.start() <= from && range.end() >= to
                    && (best < 0 || range.end() < ranges.get(best).end())) {
                best = i;
            }
        }
        return best;
    }
}
