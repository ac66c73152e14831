package org.symforge.model.types;

import org.symforge.model.HasOffset;
import org.symforge.model.HasType;
import org.symforge.model.Symbol;
import org.symforge.model.SymbolException;
import org.symforge.model.SymbolKind;
import org.symforge.model.SymbolStore;

/**
 * A member that occupies a position inside a user defined type: a field or a base class.
 * <p>
 * The member depends on its type and the owning type depends on the member, so a size change anywhere
 * below propagates up to every container.
 */
public abstract class PositionalMemberSymbol extends Symbol implements HasOffset, HasType {

    private long typeId;
    private Long declaredOffset;
    private long computedOffset;

    /**
     * @param declaredOffset The explicit offset within the owner, or {@code null} for automatic layout.
     */
    protected PositionalMemberSymbol(SymbolKind kind, long ownerId, String name, long typeId, Long declaredOffset) {
        super(kind, ownerId, name, null);
        if (declaredOffset != null && declaredOffset < 0) {
            throw SymbolException.invalidArgument("Negative member offset %d", declaredOffset);
        }
        this.typeId = typeId;
        this.declaredOffset = declaredOffset;
        this.computedOffset = declaredOffset == null ? 0 : declaredOffset;
    }

    @Override
    protected void validate(SymbolStore store) {
        if (!(store.require(parentId()) instanceof UdtTypeSymbol)) {
            throw SymbolException.invalidArgument("Owner %d of member '%s' is not a user defined type", parentId(), name());
        }
        requireType(store, typeId);
    }

    @Override
    protected void onAttach() {
        store().addDependentNotify(typeId, id());
        store().addDependentNotify(id(), parentId());
    }

    @Override
    protected void onDelete() {
        store().removeDependentNotify(typeId, id());
        store().removeDependentNotify(id(), parentId());
    }

    @Override
    public long typeId() {
        return typeId;
    }

    @Override
    public long offset() {
        return declaredOffset != null ? declaredOffset : computedOffset;
    }

    public boolean isAutomaticLayout() {
        return declaredOffset == null;
    }

    /**
     * @return The explicit offset; only meaningful when {@link #isAutomaticLayout()} is false.
     */
    public long declaredOffset() {
        return declaredOffset == null ? 0 : declaredOffset;
    }

    public void setType(long newTypeId) {
        requireType(store(), newTypeId);
        store().removeDependentNotify(typeId, id());
        typeId = newTypeId;
        store().addDependentNotify(typeId, id());
        changed();
    }

    public void setOffset(long offset) {
        if (offset < 0) {
            throw SymbolException.invalidArgument("Negative member offset %d", offset);
        }
        declaredOffset = offset;
        changed();
    }

    public void setAutomaticLayout() {
        declaredOffset = null;
        changed();
    }

    /**
     * Moves this member before the member of the same kind at {@code position} within its owner.
     */
    public void moveToBefore(long position) {
        store().moveChildBefore(parentId(), id(), position, kind());
    }

    void setComputedOffset(long offset) {
        computedOffset = offset;
    }

    private static void requireType(SymbolStore store, long id) {
        if (!(store.require(id) instanceof TypeSymbol)) {
            throw SymbolException.invalidArgument("Symbol %d is not a type", id);
        }
    }
}
