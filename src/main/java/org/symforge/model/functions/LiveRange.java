package org.symforge.model.functions;

import org.symforge.arch.Location;

/**
 * A span of a function's code over which a variable lives in one location.
 *
 * @param id The range id, unique per variable.
 * @param offset The function-relative start offset.
 * @param size The size in bytes.
 * @param location Where the variable lives over the range.
 */
public record LiveRange(long id, long offset, long size, Location location) {

    public long end() {
        return offset + size;
    }

    public boolean covers(long functionOffset) {
        return functionOffset >= offset && functionOffset < end();
    }

    LiveRange withOffset(long newOffset) {
        return new LiveRange(id, newOffset, size, location);
    }

    LiveRange withSize(long newSize) {
        return new LiveRange(id, offset, newSize, location);
    }

    LiveRange withLocation(Location newLocation) {
        return new LiveRange(id, offset, size, newLocation);
    }
}
