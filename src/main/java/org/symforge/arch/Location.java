package org.symforge.arch;

import java.util.Objects;

/**
 * The location of a value for a live range.
 *
 * @param kind The location kind.
 * @param registerId The canonical register id for register based kinds, 0 otherwise.
 * @param offset The displacement for {@link LocationKind#REGISTER_RELATIVE}, the module offset for
 *               {@link LocationKind#VIRTUAL}, 0 otherwise.
 */
public record Location(LocationKind kind, int registerId, long offset) {

    private static final Location NONE = new Location(LocationKind.NONE, 0, 0);

    public Location {
        Objects.requireNonNull(kind, "kind");
    }

    public static Location none() {
        return NONE;
    }

    public static Location register(int registerId) {
        return new Location(LocationKind.REGISTER, registerId, 0);
    }

    public static Location registerRelative(int registerId, long offset) {
        return new Location(LocationKind.REGISTER_RELATIVE, registerId, offset);
    }

    public static Location virtual(long moduleOffset) {
        return new Location(LocationKind.VIRTUAL, 0, moduleOffset);
    }

    public boolean isNone() {
        return kind == LocationKind.NONE;
    }

    public boolean isRegisterBased() {
        return kind == LocationKind.REGISTER || kind == LocationKind.REGISTER_RELATIVE;
    }

    /**
     * Compares two locations by kind, offset and the whole register owning their register ids, so that
     * {@code ecx} and {@code rcx} are equivalent.
     *
     * @param other The location to compare with.
     * @param registers The catalog used to canonicalize sub-registers.
     * @return {@code true} if both denote the same storage.
     */
    public boolean isEquivalentTo(Location other, RegisterCatalog registers) {
        if (other == null || kind != other.kind || offset != other.offset) {
            return false;
        }
        if (!isRegisterBased()) {
            return true;
        }
        return registers.wholeRegisterOf(registerId) == registers.wholeRegisterOf(other.registerId);
    }
}
