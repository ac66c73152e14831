package org.symforge.model.types;

import org.symforge.model.HasType;
import org.symforge.model.Symbol;
import org.symforge.model.SymbolException;
import org.symforge.model.SymbolKind;
import org.symforge.model.SymbolStore;

/**
 * An enumeration over an ordinal basic type. Its children are {@link EnumerantSymbol}s whose automatic
 * values are assigned by {@link #layout()}.
 */
public class EnumTypeSymbol extends TypeSymbol implements HasType {

    private final long underlyingTypeId;
    private EnumPacking packing;

    public EnumTypeSymbol(String name, String qualifiedName, long underlyingTypeId) {
        super(name, qualifiedName);
        this.underlyingTypeId = underlyingTypeId;
    }

    @Override
    protected void validate(SymbolStore store) {
        Symbol underlying = store.require(underlyingTypeId);
        if (!(underlying instanceof BasicTypeSymbol basic)) {
            throw SymbolException.invalidArgument("Enum base type %d of '%s' is not a basic type", underlyingTypeId, name());
        }
        packing = EnumPacking.forUnderlying(basic.intrinsicKind(), basic.size());
    }

    @Override
    protected void onAttach() {
        BasicTypeSymbol underlying = store().resolveReference(underlyingTypeId, BasicTypeSymbol.class);
        size = underlying.size();
        alignment = underlying.alignment();
    }

    @Override
    protected void recompute() {
        layout();
    }

    /**
     * Assigns values to automatic enumerants: zero for the first, the previous value plus one afterwards.
     * An explicit value resets the running value for later automatic enumerants.
     */
    public void layout() {
        long value = packing.zero();
        boolean foundFirst = false;
        for (long childId : childIds()) {
            Symbol child = store().resolveReference(childId, Symbol.class);
            if (child.kind() != SymbolKind.FIELD || !(child instanceof EnumerantSymbol enumerant)) {
                continue;
            }

            if (enumerant.isAutoIncrement()) {
                if (foundFirst) {
                    value = packing.increment(value);
                }
                enumerant.setComputedValue(value);
            } else {
                value = packing.normalize(enumerant.explicitValue());
            }
            foundFirst = true;
        }
    }

    @Override
    public TypeKind typeKind() {
        return TypeKind.ENUM;
    }

    @Override
    public long typeId() {
        return underlyingTypeId;
    }

    public EnumPacking packing() {
        return packing;
    }
}
