package org.symforge.arch;

/**
 * Where a variable's value lives over a live range.
 */
public enum LocationKind {
    /** No location is known. */
    NONE,
    /** The value is held in a register. */
    REGISTER,
    /** The value is in memory at a register plus an offset. */
    REGISTER_RELATIVE,
    /** The value is at a fixed module offset. */
    VIRTUAL
}
