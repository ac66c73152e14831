package org.symforge.model.index;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.TreeSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Tag("unit")
class AddressRangeIndexTest {

    @Test
    @DisplayName("Disjoint ranges are found by any address they cover")
    void query_findsDisjointRanges() {
        AddressRangeIndex index = new AddressRangeIndex();
        index.insert(0x100, 0x110, 1);
        index.insert(0x200, 0x208, 2);

        assertThat(index.query(0x100).toLongArray()).containsExactly(1L);
        assertThat(index.query(0x10f).toLongArray()).containsExactly(1L);
        assertThat(index.query(0x110).toLongArray()).isEmpty();
        assertThat(index.query(0x204).toLongArray()).containsExactly(2L);
        assertThat(index.query(0x0ff).toLongArray()).isEmpty();
    }

    @Test
    @DisplayName("Overlapping ranges split the partition into cells carrying both ids")
    void insert_splitsOverlappingRanges() {
        AddressRangeIndex index = new AddressRangeIndex();
        index.insert(0x10, 0x30, 1);
        index.insert(0x20, 0x40, 2);

        List<AddressRangeIndex.IndexCell> cells = index.cells();
        assertEquals(3, cells.size());
        assertEquals(new AddressRangeIndex.IndexCell(0x10, 0x20, List.of(1L)), cells.get(0));
        assertEquals(new AddressRangeIndex.IndexCell(0x20, 0x30, List.of(1L, 2L)), cells.get(1));
        assertEquals(new AddressRangeIndex.IndexCell(0x30, 0x40, List.of(2L)), cells.get(2));
    }

    @Test
    @DisplayName("A range inserted inside another splits it in three")
    void insert_nestedRange() {
        AddressRangeIndex index = new AddressRangeIndex();
        index.insert(0, 100, 1);
        index.insert(40, 60, 2);

        assertThat(index.query(39).toLongArray()).containsExactly(1L);
        assertThat(index.query(40).toLongArray()).containsExactly(1L, 2L);
        assertThat(index.query(59).toLongArray()).containsExactly(1L, 2L);
        assertThat(index.query(60).toLongArray()).containsExactly(1L);
        assertEquals(3, index.cells().size());
    }

    @Test
    @DisplayName("Removing everything that was inserted leaves an empty index")
    void remove_restoresEmptyIndex() {
        AddressRangeIndex index = new AddressRangeIndex();
        index.insert(0x10, 0x30, 1);
        index.insert(0x20, 0x40, 2);
        index.insert(0x25, 0x26, 3);

        assertTrue(index.remove(0x25, 0x26, 3));
        assertTrue(index.remove(0x10, 0x30, 1));
        assertTrue(index.remove(0x20, 0x40, 2));

        assertTrue(index.isEmpty());
    }

    @Test
    @DisplayName("Removing part of a range keeps the id on the remainder")
    void remove_partialRange() {
        AddressRangeIndex index = new AddressRangeIndex();
        index.insert(0, 0x30, 7);

        assertTrue(index.remove(0x10, 0x20, 7));

        assertThat(index.query(0x08).toLongArray()).containsExactly(7L);
        assertThat(index.query(0x18).toLongArray()).isEmpty();
        assertThat(index.query(0x28).toLongArray()).containsExactly(7L);
    }

    @Test
    @DisplayName("Removing an id that is not present reports no change")
    void remove_unknownIdIsNoOp() {
        AddressRangeIndex index = new AddressRangeIndex();
        index.insert(0, 0x10, 1);

        assertFalse(index.remove(0, 0x10, 2));
        assertFalse(index.remove(5, 5, 1));
        assertThat(index.query(4).toLongArray()).containsExactly(1L);
    }

    @Test
    @DisplayName("Empty ranges are ignored")
    void insert_emptyRangeIgnored() {
        AddressRangeIndex index = new AddressRangeIndex();
        index.insert(0x10, 0x10, 1);
        index.insert(0x20, 0x18, 2);

        assertTrue(index.isEmpty());
    }

    @Test
    @DisplayName("Random inserts and removes agree with a per-address model")
    void randomSequence_matchesModel() {
        int space = 64;
        Random random = new Random(42);
        AddressRangeIndex index = new AddressRangeIndex();
        List<Set<Long>> model = new ArrayList<>();
        for (int address = 0; address < space; address++) {
            model.add(new TreeSet<>());
        }
        List<long[]> inserted = new ArrayList<>();
        long nextId = 1;

        for (int step = 0; step < 400; step++) {
            if (inserted.isEmpty() || random.nextInt(3) > 0) {
                int start = random.nextInt(space);
                int end = start + random.nextInt(space - start + 1);
                long id = nextId++;
                index.insert(start, end, id);
                for (int address = start; address < end; address++) {
                    model.get(address).add(id);
                }
                inserted.add(new long[] {start, end, id});
            } else {
                long[] picked = inserted.get(random.nextInt(inserted.size()));
                int start = (int) picked[0] + random.nextInt((int) (picked[1] - picked[0]) + 1);
                int end = start + random.nextInt((int) picked[1] - start + 1);
                long id = picked[2];
                boolean present = false;
                for (int address = start; address < end; address++) {
                    present |= model.get(address).remove(id);
                }
                assertEquals(present, index.remove(start, end, id), "remove step " + step);
            }

            for (int address = 0; address < space; address++) {
                long[] ids = index.query(address).toLongArray();
                Arrays.sort(ids);
                long[] expected = model.get(address).stream().mapToLong(Long::longValue).toArray();
                assertArrayEquals(expected, ids, "address " + address + " after step " + step);
            }
            assertPartition(index.cells());
        }

        boolean modelEmpty = model.stream().allMatch(Set::isEmpty);
        assertEquals(modelEmpty, index.isEmpty());
    }

    private static void assertPartition(List<AddressRangeIndex.IndexCell> cells) {
        for (int i = 0; i < cells.size(); i++) {
            AddressRangeIndex.IndexCell cell = cells.get(i);
            assertTrue(cell.start() < cell.end(), "empty cell " + cell);
            assertFalse(cell.ids().isEmpty(), "cell without ids " + cell);
            if (i > 0) {
                assertTrue(cells.get(i - 1).end() <= cell.start(), "overlapping cells at " + cell);
            }
        }
    }
}
