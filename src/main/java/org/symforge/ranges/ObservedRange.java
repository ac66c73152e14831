package org.symforge.ranges;

import org.symforge.arch.Location;

/**
 * A span of absolute addresses over which one parameter was seen at one location during a block walk.
 *
 * @param parameterIndex The index of the parameter.
 * @param start The first address.
 * @param end The address just past the span.
 * @param location The location.
 * @param traversal The traversal count of the walk that recorded the span.
 */
record ObservedRange(int parameterIndex, long start, long end, Location location, int traversal) {

    long size() {
        return end - start;
    }

    boolean isEmpty() {
        return end <= start;
    }

    ObservedRange withStart(long newStart) {
        return new ObservedRange(parameterIndex, newStart, end, location, traversal);
    }

    ObservedRange withEnd(long newEnd) {
        return new ObservedRange(parameterIndex, start, newEnd, location, traversal);
    }
}
