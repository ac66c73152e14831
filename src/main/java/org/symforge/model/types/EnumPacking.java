package org.symforge.model.types;

import org.symforge.model.SymbolException;

/**
 * The numeric representation enumerant values are packed into, derived from an enum's underlying type.
 * Values are carried as {@code long}; {@link #normalize(long)} truncates them to the packing width and
 * sign-extends for signed packings.
 */
public enum EnumPacking {
    BOOL(1, false),
    I1(1, true),
    UI1(1, false),
    I2(2, true),
    UI2(2, false),
    I4(4, true),
    UI4(4, false),
    I8(8, true),
    UI8(8, false);

    private final int width;
    private final boolean signed;

    EnumPacking(int width, boolean signed) {
        this.width = width;
        this.signed = signed;
    }

    /**
     * Selects the packing for an enum based on its underlying basic type.
     *
     * @param kind The intrinsic kind of the underlying type.
     * @param size The size of the underlying type in bytes.
     * @return The packing.
     * @throws SymbolException {@code INVALID_ARGUMENT} if the type is not ordinal or has an odd size.
     */
    public static EnumPacking forUnderlying(IntrinsicKind kind, long size) {
        boolean isSigned;
        switch (kind) {
            case BOOL:
                return BOOL;
            case CHAR:
            case INT:
            case LONG:
                isSigned = true;
                break;
            case WCHAR:
            case UINT:
            case ULONG:
                isSigned = false;
                break;
            default:
                throw SymbolException.invalidArgument("Enum base type of kind %s is not ordinal", kind);
        }

        switch ((int) size) {
            case 1:
                return isSigned ? I1 : UI1;
            case 2:
                return isSigned ? I2 : UI2;
            case 4:
                return isSigned ? I4 : UI4;
            case 8:
                return isSigned ? I8 : UI8;
            default:
                throw SymbolException.invalidArgument("Enum base type size %d is not packable", size);
        }
    }

    public int width() {
        return width;
    }

    public boolean isSigned() {
        return signed;
    }

    public long zero() {
        return 0L;
    }

    public long normalize(long value) {
        if (this == BOOL) {
            return value != 0 ? 1L : 0L;
        }
        if (width == 8) {
            return value;
        }
        int bits = width * 8;
        long masked = value & ((1L << bits) - 1);
        if (signed && (masked & (1L << (bits - 1))) != 0) {
            masked |= -1L << bits;
        }
        return masked;
    }

    /**
     * @return The next value after {@code value}, wrapping at the packing width. A boolean packing goes
     *         from false to true and then stays true.
     */
    public long increment(long value) {
        if (this == BOOL) {
            return 1L;
        }
        return normalize(value + 1);
    }
}
