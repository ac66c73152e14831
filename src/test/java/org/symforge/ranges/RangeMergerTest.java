package org.symforge.ranges;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.symforge.arch.Amd64RegisterCatalog;
import org.symforge.arch.Location;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

@Tag("unit")
class RangeMergerTest {

    private static final Location ECX = Location.register(18);
    private static final Location RCX = Location.register(330);
    private static final Location EBX = Location.register(20);

    private final RangeMerger merger = new RangeMerger(Amd64RegisterCatalog.create());

    @Test
    @DisplayName("Overlapping and touching ranges of one walk at one location coalesce")
    void merge_coalescesCompatibleRanges() {
        List<ObservedRange> merged = merger.merge(List.of(
                range(0x10, 0x20, ECX, 1),
                range(0x00, 0x10, ECX, 1),
                range(0x18, 0x30, RCX, 1)));

        assertEquals(List.of(range(0x00, 0x30, ECX, 1)), merged);
        assertEquals(0, merger.deferredSplits());
    }

    @Test
    @DisplayName("Conflicting overlaps go to the range that ends first")
    void merge_soonestEndingWins() {
        List<ObservedRange> merged = merger.merge(List.of(
                range(0x00, 0x20, ECX, 1),
                range(0x10, 0x18, EBX, 1)));

        assertEquals(List.of(
                range(0x00, 0x10, ECX, 1),
                range(0x10, 0x18, EBX, 1),
                range(0x18, 0x20, ECX, 1)), merged);
        assertEquals(1, merger.deferredSplits());
    }

    @Test
    @DisplayName("Adjacent pieces from different walks at an equivalent location are joined")
    void merge_joinsAcrossTraversals() {
        List<ObservedRange> merged = merger.merge(List.of(
                range(0x00, 0x10, ECX, 1),
                range(0x10, 0x18, RCX, 2)));

        assertEquals(List.of(range(0x00, 0x18, ECX, 1)), merged);
        assertEquals(0, merger.deferredSplits());
    }

    @Test
    @DisplayName("Gaps between ranges are kept")
    void merge_keepsGaps() {
        List<ObservedRange> merged = merger.merge(List.of(
                range(0x00, 0x08, ECX, 1),
                range(0x10, 0x18, ECX, 1)));

        assertEquals(2, merged.size());
        assertEquals(0x08, merged.get(0).end());
        assertEquals(0x10, merged.get(1).start());
    }

    @Test
    @DisplayName("Nothing observed merges to nothing")
    void merge_empty() {
        assertEquals(List.of(), merger.merge(List.of()));
    }

    private static ObservedRange range(long start, long end, Location location, int traversal) {
        return new ObservedRange(0, start, end, location, traversal);
    }
}
