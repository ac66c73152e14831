package org.symforge.model.types;

import org.symforge.model.HasType;
import org.symforge.model.SymbolException;
import org.symforge.model.SymbolStore;

/**
 * A fixed-size array. Its size follows the element type, which it depends on.
 */
public class ArrayTypeSymbol extends TypeSymbol implements HasType {

    private final long elementTypeId;
    private final long dimension;

    public ArrayTypeSymbol(String name, long elementTypeId, long dimension) {
        super(name, null);
        if (dimension < 0) {
            throw SymbolException.invalidArgument("Negative array dimension %d", dimension);
        }
        this.elementTypeId = elementTypeId;
        this.dimension = dimension;
    }

    @Override
    protected void validate(SymbolStore store) {
        if (!(store.require(elementTypeId) instanceof TypeSymbol)) {
            throw SymbolException.invalidArgument("Element %d of array '%s' is not a type", elementTypeId, name());
        }
    }

    @Override
    protected void onAttach() {
        store().addDependentNotify(elementTypeId, id());
        recompute();
    }

    @Override
    protected void recompute() {
        TypeSymbol element = store().resolveReference(elementTypeId, TypeSymbol.class);
        size = Math.multiplyExact(element.size(), dimension);
        alignment = element.alignment();
    }

    @Override
    protected void onDelete() {
        store().removeDependentNotify(elementTypeId, id());
    }

    @Override
    public TypeKind typeKind() {
        return TypeKind.ARRAY;
    }

    @Override
    public long typeId() {
        return elementTypeId;
    }

    public long dimension() {
        return dimension;
    }
}
