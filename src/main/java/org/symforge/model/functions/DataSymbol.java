package org.symforge.model.functions;

import org.symforge.model.HasOffset;
import org.symforge.model.HasType;
import org.symforge.model.Symbol;
import org.symforge.model.SymbolException;
import org.symforge.model.SymbolKind;
import org.symforge.model.SymbolStore;
import org.symforge.model.types.TypeSymbol;

/**
 * A global variable at a fixed module offset. It occupies {@code [offset, offset + typeSize)} in the
 * address index and moves there whenever its offset or its type's size changes.
 */
public class DataSymbol extends Symbol implements HasOffset, HasType {

    private long offset;
    private long typeId;
    private long indexedOffset;
    private long indexedSize;

    public DataSymbol(String name, String qualifiedName, long typeId, long offset) {
        super(SymbolKind.DATA, 0, name, qualifiedName);
        if (name == null || name.isBlank()) {
            throw SymbolException.invalidArgument("Global data requires a name");
        }
        this.typeId = typeId;
        this.offset = offset;
    }

    @Override
    protected void validate(SymbolStore store) {
        requireType(store, typeId);
    }

    @Override
    protected void onAttach() {
        store().addDependentNotify(typeId, id());
        indexedOffset = offset;
        indexedSize = currentSize();
        store().rangeIndex().insert(indexedOffset, indexedOffset + indexedSize, id());
    }

    @Override
    protected void recompute() {
        long size = currentSize();
        if (size != indexedSize || offset != indexedOffset) {
            store().rangeIndex().remove(indexedOffset, indexedOffset + indexedSize, id());
            indexedOffset = offset;
            indexedSize = size;
            store().rangeIndex().insert(indexedOffset, indexedOffset + indexedSize, id());
        }
    }

    @Override
    protected void onDelete() {
        store().removeDependentNotify(typeId, id());
        store().rangeIndex().remove(indexedOffset, indexedOffset + indexedSize, id());
    }

    @Override
    public long offset() {
        return offset;
    }

    @Override
    public long typeId() {
        return typeId;
    }

    public void setOffset(long newOffset) {
        offset = newOffset;
        changed();
    }

    public void setType(long newTypeId) {
        requireType(store(), newTypeId);
        store().removeDependentNotify(typeId, id());
        typeId = newTypeId;
        store().addDependentNotify(typeId, id());
        changed();
    }

    private long currentSize() {
        return store().resolveReference(typeId, TypeSymbol.class).size();
    }

    private static void requireType(SymbolStore store, long id) {
        if (!(store.require(id) instanceof TypeSymbol)) {
            throw SymbolException.invalidArgument("Symbol %d is not a type", id);
        }
    }
}
