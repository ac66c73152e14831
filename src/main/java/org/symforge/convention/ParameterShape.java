package org.symforge.convention;

import org.symforge.model.SymbolStore;
import org.symforge.model.types.BasicTypeSymbol;
import org.symforge.model.types.TypeSymbol;

/**
 * What a calling convention needs to know about a parameter's type once typedefs are unwound.
 *
 * @param floating {@code true} if the value travels in the floating point register sequence.
 * @param size The value size in bytes.
 */
public record ParameterShape(boolean floating, long size) {

    /**
     * @param store The store holding the type.
     * @param typeId The declared parameter type, possibly a typedef.
     * @return The shape of the underlying type.
     */
    public static ParameterShape of(SymbolStore store, long typeId) {
        TypeSymbol type = store.resolveReference(typeId, TypeSymbol.class).withoutTypedefs();
        boolean floating = type instanceof BasicTypeSymbol basic && basic.intrinsicKind().isFloatingPoint();
        return new ParameterShape(floating, type.size());
    }
}
