package org.symforge.model.functions;

import org.symforge.model.HasOffset;
import org.symforge.model.Symbol;
import org.symforge.model.SymbolException;
import org.symforge.model.SymbolKind;

/**
 * A named module offset without size or type, such as an export.
 */
public class PublicSymbol extends Symbol implements HasOffset {

    private final long offset;

    public PublicSymbol(String name, String qualifiedName, long offset) {
        super(SymbolKind.PUBLIC, 0, name, qualifiedName);
        if (name == null || name.isBlank()) {
            throw SymbolException.invalidArgument("Public symbol requires a name");
        }
        this.offset = offset;
    }

    @Override
    protected void onAttach() {
        store().publicIndex().insert(offset, id());
    }

    @Override
    protected void onDelete() {
        store().publicIndex().remove(offset, id());
    }

    @Override
    public long offset() {
        return offset;
    }
}
