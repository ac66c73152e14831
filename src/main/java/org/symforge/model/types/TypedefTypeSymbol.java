package org.symforge.model.types;

import org.symforge.model.HasType;
import org.symforge.model.SymbolException;
import org.symforge.model.SymbolStore;

/**
 * An alias of another type, with the same size and alignment.
 */
public class TypedefTypeSymbol extends TypeSymbol implements HasType {

    private final long targetTypeId;

    public TypedefTypeSymbol(String name, String qualifiedName, long targetTypeId) {
        super(name, qualifiedName);
        this.targetTypeId = targetTypeId;
    }

    @Override
    protected void validate(SymbolStore store) {
        if (!(store.require(targetTypeId) instanceof TypeSymbol)) {
            throw SymbolException.invalidArgument("Typedef target %d of '%s' is not a type", targetTypeId, name());
        }
    }

    @Override
    protected void onAttach() {
        store().addDependentNotify(targetTypeId, id());
        recompute();
    }

    @Override
    protected void recompute() {
        TypeSymbol target = store().resolveReference(targetTypeId, TypeSymbol.class);
        size = target.size();
        alignment = target.alignment();
    }

    @Override
    protected void onDelete() {
        store().removeDependentNotify(targetTypeId, id());
    }

    @Override
    public TypeKind typeKind() {
        return TypeKind.TYPEDEF;
    }

    @Override
    public long typeId() {
        return targetTypeId;
    }

    @Override
    public TypeSymbol withoutTypedefs() {
        return store().resolveReference(targetTypeId, TypeSymbol.class).withoutTypedefs();
    }
}
