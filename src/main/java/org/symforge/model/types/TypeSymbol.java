package org.symforge.model.types;

import org.symforge.model.Symbol;
import org.symforge.model.SymbolKind;

/**
 * Base of all type variants. Size and alignment are derived state: they hold until the next dependency
 * notification recomputes them.
 */
public abstract class TypeSymbol extends Symbol {

    protected long size;
    protected long alignment = 1;

    protected TypeSymbol(String name, String qualifiedName) {
        super(SymbolKind.TYPE, 0, name, qualifiedName);
    }

    public abstract TypeKind typeKind();

    /**
     * @return The size of the type in bytes.
     */
    public long size() {
        return size;
    }

    /**
     * @return The alignment of the type in bytes, never less than 1.
     */
    public long alignment() {
        return Math.max(1, alignment);
    }

    /**
     * @return The type with all typedef layers removed.
     */
    public TypeSymbol withoutTypedefs() {
        return this;
    }

    static long roundUp(long value, long alignment) {
        long a = Math.max(1, alignment);
        long remainder = value % a;
        return remainder == 0 ? value : value + (a - remainder);
    }
}
