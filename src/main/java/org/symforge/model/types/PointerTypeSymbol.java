package org.symforge.model.types;

import org.symforge.model.HasType;
import org.symforge.model.SymbolException;
import org.symforge.model.SymbolStore;

import java.util.Objects;

/**
 * A pointer or reference to another type. Size and alignment are the architecture pointer width.
 */
public class PointerTypeSymbol extends TypeSymbol implements HasType {

    private final long pointeeId;
    private final PointerKind pointerKind;

    public PointerTypeSymbol(String name, long pointeeId, PointerKind pointerKind) {
        super(name, null);
        this.pointeeId = pointeeId;
        this.pointerKind = Objects.requireNonNull(pointerKind, "pointerKind");
    }

    @Override
    protected void validate(SymbolStore store) {
        if (!(store.require(pointeeId) instanceof TypeSymbol)) {
            throw SymbolException.invalidArgument("Pointee %d of '%s' is not a type", pointeeId, name());
        }
    }

    @Override
    protected void onAttach() {
        size = store().pointerSize();
        alignment = store().pointerSize();
    }

    @Override
    public TypeKind typeKind() {
        return TypeKind.POINTER;
    }

    @Override
    public long typeId() {
        return pointeeId;
    }

    public PointerKind pointerKind() {
        return pointerKind;
    }
}
