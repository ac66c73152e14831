package org.symforge.model;

import it.unimi.dsi.fastutil.longs.LongArrayList;
import it.unimi.dsi.fastutil.longs.LongList;
import it.unimi.dsi.fastutil.longs.LongLists;

/**
 * Base of every symbol in a {@link SymbolStore}. A symbol is created detached, validated and attached by
 * {@link SymbolStore#add(Symbol)}, and from then on refers to other symbols only by id.
 * <p>
 * Subclasses hook into the store lifecycle through {@link #validate(SymbolStore)}, {@link #onAttach()},
 * {@link #recompute()} and {@link #onDelete()}.
 */
public abstract class Symbol {

    private final SymbolKind kind;
    private final long parentId;
    private final String name;
    private final String qualifiedName;
    private final LongArrayList children = new LongArrayList();

    private SymbolStore store;
    private long id;

    protected Symbol(SymbolKind kind, long parentId, String name, String qualifiedName) {
        this.kind = kind;
        this.parentId = parentId;
        this.name = name;
        this.qualifiedName = qualifiedName;
    }

    public long id() {
        return id;
    }

    public SymbolKind kind() {
        return kind;
    }

    public long parentId() {
        return parentId;
    }

    /**
     * @return The symbol's name, or {@code null} for anonymous symbols.
     */
    public String name() {
        return name;
    }

    /**
     * @return The qualified name, or {@code null} if none was given.
     */
    public String qualifiedName() {
        return qualifiedName;
    }

    /**
     * @return The key under which a global symbol is indexed, or {@code null} if it is anonymous.
     */
    public String indexName() {
        if (qualifiedName != null && !qualifiedName.isEmpty()) {
            return qualifiedName;
        }
        return (name == null || name.isEmpty()) ? null : name;
    }

    /**
     * @return The ordered child ids.
     */
    public LongList childIds() {
        return LongLists.unmodifiable(children);
    }

    public boolean isAttached() {
        return store != null;
    }

    protected SymbolStore store() {
        if (store == null) {
            throw new IllegalStateException("Symbol is not attached to a store: " + name);
        }
        return store;
    }

    /**
     * Checks the symbol's references against the store before an id is allocated.
     *
     * @param store The store the symbol is about to join.
     */
    protected void validate(SymbolStore store) {
    }

    /**
     * Registers index entries and dependencies once the id is known.
     */
    protected void onAttach() {
    }

    /**
     * Recomputes derived state after something this symbol depends on changed.
     */
    protected void recompute() {
    }

    /**
     * Drops index entries and the dependencies this symbol registered on others.
     */
    protected void onDelete() {
    }

    /**
     * Propagates a change of this symbol to everything depending on it and tells listeners.
     */
    protected void changed() {
        store().notifyDependentChange(id);
        store().invalidateExternalCaches();
    }

    final void attach(SymbolStore owner, long assignedId) {
        this.store = owner;
        this.id = assignedId;
    }

    final void detach() {
        this.store = null;
    }

    final void addChild(long childId) {
        children.add(childId);
    }

    final boolean removeChild(long childId) {
        return children.rem(childId);
    }

    /**
     * Moves {@code childId} before the child at {@code position}. When {@code relativeKind} is given the
     * position counts only children of that kind; a position past the end moves the child to the end.
     */
    final void moveChildBefore(long childId, long position, SymbolKind relativeKind) {
        int current = children.indexOf(childId);
        if (current < 0) {
            throw SymbolException.invalidArgument("Symbol %d is not a child of symbol %d", childId, id);
        }
        if (position < 0) {
            throw SymbolException.invalidArgument("Negative position %d", position);
        }

        int target = children.size();
        if (relativeKind == null) {
            target = (int) Math.min(position, children.size());
        } else {
            long seen = 0;
            for (int i = 0; i < children.size(); i++) {
                Symbol child = store().resolveReference(children.getLong(i), Symbol.class);
                if (child.kind() != relativeKind) {
                    continue;
                }
                if (seen == position) {
                    target = i;
                    break;
                }
                seen++;
            }
        }

        if (target > current) {
            target--;
        }
        children.removeLong(current);
        children.add(target, childId);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + id + ", " + kind + ", " + name + "]";
    }
}
