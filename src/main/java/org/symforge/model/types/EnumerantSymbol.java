package org.symforge.model.types;

import org.symforge.model.HasType;
import org.symforge.model.Symbol;
import org.symforge.model.SymbolException;
import org.symforge.model.SymbolKind;
import org.symforge.model.SymbolStore;

/**
 * A named constant of an enum. Its value is either explicit or assigned by the enum's layout.
 */
public class EnumerantSymbol extends Symbol implements HasType {

    private final long typeId;
    private Long explicitValue;
    private long computedValue;

    /**
     * @param typeId The enumerant's type, or 0 to use the enum's underlying type.
     * @param value The explicit value, or {@code null} to take the previous value plus one.
     */
    public EnumerantSymbol(long enumId, String name, long typeId, Long value) {
        super(SymbolKind.FIELD, enumId, name, null);
        if (name == null || name.isBlank()) {
            throw SymbolException.invalidArgument("Enumerant requires a name");
        }
        this.typeId = typeId;
        this.explicitValue = value;
    }

    @Override
    protected void validate(SymbolStore store) {
        if (!(store.require(parentId()) instanceof EnumTypeSymbol)) {
            throw SymbolException.invalidArgument("Owner %d of enumerant '%s' is not an enum", parentId(), name());
        }
        if (typeId != 0 && !(store.require(typeId) instanceof TypeSymbol)) {
            throw SymbolException.invalidArgument("Symbol %d is not a type", typeId);
        }
    }

    @Override
    protected void onAttach() {
        store().addDependentNotify(id(), parentId());
    }

    @Override
    protected void onDelete() {
        store().removeDependentNotify(id(), parentId());
    }

    @Override
    public long typeId() {
        return typeId != 0 ? typeId : store().resolveReference(parentId(), EnumTypeSymbol.class).typeId();
    }

    public boolean isAutoIncrement() {
        return explicitValue == null;
    }

    long explicitValue() {
        return explicitValue == null ? 0 : explicitValue;
    }

    /**
     * @return The enumerant's value, packed to the enum's representation.
     */
    public long value() {
        if (explicitValue != null) {
            return store().resolveReference(parentId(), EnumTypeSymbol.class).packing().normalize(explicitValue);
        }
        return computedValue;
    }

    public void setValue(long value) {
        explicitValue = value;
        changed();
    }

    public void setAutoIncrement() {
        explicitValue = null;
        changed();
    }

    public void moveToBefore(long position) {
        store().moveChildBefore(parentId(), id(), position, SymbolKind.FIELD);
    }

    void setComputedValue(long value) {
        computedValue = value;
    }
}
