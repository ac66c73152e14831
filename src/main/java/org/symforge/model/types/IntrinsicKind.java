package org.symforge.model.types;

/**
 * The kinds of basic (intrinsic) types.
 */
public enum IntrinsicKind {
    VOID,
    BOOL,
    CHAR,
    WCHAR,
    INT,
    UINT,
    LONG,
    ULONG,
    FLOAT,
    CHAR16,
    CHAR32;

    public boolean isFloatingPoint() {
        return this == FLOAT;
    }
}
