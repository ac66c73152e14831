package org.symforge.model.types;

import org.symforge.model.SymbolException;

import java.util.Objects;

/**
 * An intrinsic type such as {@code int} or {@code double}. Its alignment equals its size.
 */
public class BasicTypeSymbol extends TypeSymbol {

    private final IntrinsicKind intrinsicKind;

    public BasicTypeSymbol(String name, IntrinsicKind intrinsicKind, long size) {
        super(name, null);
        this.intrinsicKind = Objects.requireNonNull(intrinsicKind, "intrinsicKind");
        if (size < 0) {
            throw SymbolException.invalidArgument("Negative size %d for basic type '%s'", size, name);
        }
        if (name == null || name.isBlank()) {
            throw SymbolException.invalidArgument("Basic type requires a name");
        }
        this.size = size;
        this.alignment = size;
    }

    @Override
    public TypeKind typeKind() {
        return TypeKind.INTRINSIC;
    }

    public IntrinsicKind intrinsicKind() {
        return intrinsicKind;
    }
}
