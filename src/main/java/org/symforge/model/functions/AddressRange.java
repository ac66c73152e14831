package org.symforge.model.functions;

/**
 * A half-open {@code [offset, offset + size)} span of module code.
 */
public record AddressRange(long offset, long size) {

    public long end() {
        return offset + size;
    }

    public boolean contains(long address) {
        return address >= offset && address < end();
    }

    public boolean contains(long start, long length) {
        return start >= offset && start + length <= end();
    }

    public boolean overlaps(long start, long length) {
        return start < end() && offset < start + length;
    }
}
