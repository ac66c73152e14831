package org.symforge.model.index;

import it.unimi.dsi.fastutil.longs.LongArrayList;
import it.unimi.dsi.fastutil.longs.LongList;
import it.unimi.dsi.fastutil.longs.LongLists;

import java.util.ArrayList;
import java.util.List;

/**
 * A half-open address range multimap. Inserted ranges may overlap; the index keeps a sorted,
 * non-overlapping partition of the covered address space where each cell carries the ids of every
 * inserted range that covers it. Inserting and removing split cells as needed.
 * <p>
 * This class is not thread-safe.
 */
public final class AddressRangeIndex {

    private final List<Cell> cells = new ArrayList<>();

    /**
     * Adds {@code id} over {@code [start, end)}. An empty range is ignored.
     *
     * @param start The inclusive start address.
     * @param end The exclusive end address.
     * @param id The owning symbol id.
     */
    public void insert(long start, long end, long id) {
        if (end <= start) {
            return;
        }

        long cursor = start;
        int i = firstCellEndingAfter(cursor);
        while (cursor < end) {
            if (i == cells.size() || cells.get(i).start >= end) {
                cells.add(i, new Cell(cursor, end, LongArrayList.wrap(new long[]{id})));
                return;
            }

            Cell cell = cells.get(i);
            if (cursor < cell.start) {
                // Gap in front of the next cell.
                cells.add(i, new Cell(cursor, cell.start, LongArrayList.wrap(new long[]{id})));
                i++;
                cursor = cell.start;
                continue;
            }

            if (cursor > cell.start) {
                cells.add(i, new Cell(cell.start, cursor, new LongArrayList(cell.ids)));
                i++;
                cell.start = cursor;
            }
            if (end < cell.end) {
                cells.add(i + 1, new Cell(end, cell.end, new LongArrayList(cell.ids)));
                cell.end = end;
            }

            cell.ids.add(id);
            cursor = cell.end;
            i++;
        }
    }

    /**
     * Removes {@code id} from {@code [start, end)}. Parts of cells outside the range keep the id.
     *
     * @param start The inclusive start address.
     * @param end The exclusive end address.
     * @param id The owning symbol id.
     * @return {@code true} if the id was present anywhere in the range, {@code false} if nothing changed.
     */
    public boolean remove(long start, long end, long id) {
        if (end <= start) {
            return false;
        }

        boolean changed = false;
        int i = firstCellEndingAfter(start);
        while (i < cells.size() && cells.get(i).start < end) {
            Cell cell = cells.get(i);
            if (!cell.ids.contains(id)) {
                i++;
                continue;
            }

            if (cell.start < start) {
                cells.add(i, new Cell(cell.start, start, new LongArrayList(cell.ids)));
                i++;
                cell.start = start;
            }
            if (cell.end > end) {
                cells.add(i + 1, new Cell(end, cell.end, new LongArrayList(cell.ids)));
                cell.end = end;
            }

            cell.ids.rem(id);
            changed = true;
            if (cell.ids.isEmpty()) {
                cells.remove(i);
            } else {
                i++;
            }
        }
        return changed;
    }

    /**
     * Returns the ids of every range covering {@code address}, in insertion order within the cell.
     *
     * @param address The address to look up.
     * @return An unmodifiable list of ids; empty if nothing covers the address.
     */
    public LongList query(long address) {
        int i = firstCellEndingAfter(address);
        if (i < cells.size() && cells.get(i).start <= address) {
            return LongLists.unmodifiable(new LongArrayList(cells.get(i).ids));
        }
        return LongLists.EMPTY_LIST;
    }

    /**
     * @return A snapshot of the partition cells in address order.
     */
    public List<IndexCell> cells() {
        List<IndexCell> snapshot = new ArrayList<>(cells.size());
        for (Cell cell : cells) {
            snapshot.add(new IndexCell(cell.start, cell.end, List.copyOf(cell.ids)));
        }
        return snapshot;
    }

    public boolean isEmpty() {
        return cells.isEmpty();
    }

    /**
     * Binary search for the first cell whose exclusive end lies beyond {@code address}.
     */
    private int firstCellEndingAfter(long address) {
        int low = 0;
        int high = cells.size();
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (cells.get(mid).end > address) {
                high = mid;
            } else {
                low = mid + 1;
            }
        }
        return low;
    }

    /**
     * One cell of the partition as seen from outside the index.
     *
     * @param start The inclusive start address.
     * @param end The exclusive end address.
     * @param ids The ids covering the cell.
     */
    public record IndexCell(long start, long end, List<Long> ids) {
    }

    private static final class Cell {
        long start;
        long end;
        final LongArrayList ids;

        Cell(long start, long end, LongArrayList ids) {
            this.start = start;
            this.end = end;
            this.ids = ids;
        }
    }
}
