package org.symforge.model.functions;

import it.unimi.dsi.fastutil.longs.LongList;
import org.symforge.model.Symbol;
import org.symforge.model.SymbolException;
import org.symforge.model.SymbolStore;

/**
 * Finds the function covering a code address and wraps it in a {@link Scope}.
 */
public final class ScopeResolver {

    private final SymbolStore store;

    public ScopeResolver(SymbolStore store) {
        this.store = store;
    }

    /**
     * @param moduleOffset An offset from the module base.
     * @return The scope of the function whose ranges contain the offset.
     * @throws SymbolException {@code NOT_FOUND} if no function covers the offset.
     */
    public Scope findByOffset(long moduleOffset) {
        LongList ids = store.rangeIndex().query(moduleOffset);
        for (int i = 0; i < ids.size(); i++) {
            Symbol symbol = store.find(ids.getLong(i)).orElse(null);
            if (symbol instanceof FunctionSymbol function) {
                return Scope.capture(function, function.toFunctionOffset(moduleOffset));
            }
        }
        throw SymbolException.notFound("No function covers offset %#x", moduleOffset);
    }
}
