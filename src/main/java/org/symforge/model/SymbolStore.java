package org.symforge.model;

import it.unimi.dsi.fastutil.longs.Long2ObjectLinkedOpenHashMap;
import it.unimi.dsi.fastutil.longs.LongArrayList;
import it.unimi.dsi.fastutil.longs.LongLinkedOpenHashSet;
import it.unimi.dsi.fastutil.longs.LongList;
import org.symforge.model.index.AddressPointIndex;
import org.symforge.model.index.AddressRangeIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * The arena owning every symbol of one symbol set. It allocates ids, maintains the name, global and
 * address indices, the dependency graph and the cache-invalidation broadcast.
 * <p>
 * All cross references between symbols are ids resolved through this store, so deleting a symbol can
 * never dangle a reference; it can only make an id stop resolving.
 * <p>
 * This class is not thread-safe. Callers serialize access per store.
 */
public final class SymbolStore {

    private static final Logger LOG = LoggerFactory.getLogger(SymbolStore.class);

    private final int pointerSize;
    private final Long2ObjectLinkedOpenHashMap<Symbol> symbols = new Long2ObjectLinkedOpenHashMap<>();
    private final Map<String, Long> namedGlobals = new HashMap<>();
    private final LongLinkedOpenHashSet globalIds = new LongLinkedOpenHashSet();
    private final DependencyGraph dependencies = new DependencyGraph();
    private final AddressRangeIndex rangeIndex = new AddressRangeIndex();
    private final AddressPointIndex publicIndex = new AddressPointIndex();
    private final List<CacheInvalidationListener> listeners = new CopyOnWriteArrayList<>();
    private final Map<Object, Long> interned = new HashMap<>();
    private long nextId = 0;

    /**
     * @param pointerSize The architecture pointer width in bytes.
     */
    public SymbolStore(int pointerSize) {
        if (pointerSize <= 0) {
            throw new IllegalArgumentException("Pointer size must be positive: " + pointerSize);
        }
        this.pointerSize = pointerSize;
    }

    public int pointerSize() {
        return pointerSize;
    }

    // region Lifecycle

    /**
     * Validates and attaches a new symbol.
     *
     * @param symbol A detached symbol.
     * @return The allocated id.
     */
    public long add(Symbol symbol) {
        Objects.requireNonNull(symbol, "symbol");
        if (symbol.isAttached()) {
            throw SymbolException.invalidArgument("Symbol is already attached: %s", symbol);
        }
        Symbol parent = null;
        if (symbol.parentId() != 0) {
            parent = require(symbol.parentId());
        }
        symbol.validate(this);

        if (nextId == Long.MAX_VALUE) {
            throw SymbolException.unexpected("Symbol id space exhausted");
        }
        long id = ++nextId;
        symbol.attach(this, id);
        symbols.put(id, symbol);

        try {
            if (symbol.kind().isGlobal()) {
                globalIds.add(id);
                String key = symbol.indexName();
                if (key != null) {
                    namedGlobals.putIfAbsent(key, id);
                }
            }

            symbol.onAttach();

            if (parent != null) {
                parent.addChild(id);
                notifyDependentChange(parent.id());
            }
        } catch (RuntimeException e) {
            rollBackAdd(symbol, parent, e);
            throw e;
        }

        LOG.debug("Added {}", symbol);
        invalidateExternalCaches();
        return id;
    }

    /**
     * Undoes a partially applied {@link #add}. Failures while undoing are attached to {@code failure}.
     */
    private void rollBackAdd(Symbol symbol, Symbol parent, RuntimeException failure) {
        long id = symbol.id();
        try {
            symbol.onDelete();
        } catch (RuntimeException e) {
            failure.addSuppressed(e);
        }
        if (parent != null && parent.removeChild(id)) {
            try {
                notifyDependentChange(parent.id());
            } catch (RuntimeException e) {
                failure.addSuppressed(e);
            }
        }
        String key = symbol.indexName();
        if (key != null) {
            namedGlobals.remove(key, id);
        }
        globalIds.remove(id);
        dependencies.forget(id);
        symbols.remove(id);
        symbol.detach();
        LOG.debug("Rolled back add of {}: {}", symbol, failure.getMessage());
    }

    /**
     * Deletes a symbol and the children it owns. Symbols that merely depend on it are left alone and
     * become zombies.
     *
     * @param id The symbol to delete.
     */
    public void delete(long id) {
        Symbol symbol = require(id);

        for (long childId : new LongArrayList(symbol.childIds())) {
            if (symbols.containsKey(childId)) {
                delete(childId);
            }
        }

        symbol.onDelete();

        if (symbol.parentId() != 0) {
            Symbol parent = symbols.get(symbol.parentId());
            if (parent != null && parent.removeChild(id)) {
                notifyDependentChange(parent.id());
            }
        }

        String key = symbol.indexName();
        if (key != null) {
            namedGlobals.remove(key, id);
        }
        globalIds.remove(id);
        dependencies.forget(id);
        symbols.remove(id);
        symbol.detach();

        LOG.debug("Deleted {}", symbol);
        invalidateExternalCaches();
    }

    /**
     * Returns the live symbol registered under a structural key, adding the one produced by
     * {@code factory} if there is none. Used for types that are identified by shape rather than name.
     *
     * @param key A value object describing the structure.
     * @param factory Creates the detached symbol when needed.
     * @return The id of the interned symbol.
     */
    public long intern(Object key, Supplier<? extends Symbol> factory) {
        Long existing = interned.get(key);
        if (existing != null && symbols.containsKey(existing)) {
            return existing;
        }
        long id = add(factory.get());
        interned.put(key, id);
        return id;
    }

    // endregion

    // region Resolution

    public Optional<Symbol> find(long id) {
        return Optional.ofNullable(symbols.get(id));
    }

    public boolean contains(long id) {
        return symbols.containsKey(id);
    }

    /**
     * Resolves an id supplied by a caller.
     *
     * @throws SymbolException {@code NOT_FOUND} if the id does not resolve.
     */
    public Symbol require(long id) {
        Symbol symbol = symbols.get(id);
        if (symbol == null) {
            throw SymbolException.notFound("Symbol %d does not resolve", id);
        }
        return symbol;
    }

    /**
     * Resolves a caller-supplied id that must be of a particular class.
     *
     * @throws SymbolException {@code NOT_FOUND} if missing, {@code INVALID_ARGUMENT} if of another kind.
     */
    public <T extends Symbol> T require(long id, Class<T> type) {
        Symbol symbol = require(id);
        if (!type.isInstance(symbol)) {
            throw SymbolException.invalidArgument("Symbol %d is a %s, not a %s", id,
                    symbol.getClass().getSimpleName(), type.getSimpleName());
        }
        return type.cast(symbol);
    }

    /**
     * Resolves an id stored inside the symbol graph. A miss here means the graph points at a deleted or
     * wrong-kind symbol.
     *
     * @throws SymbolException {@code UNEXPECTED} if the reference is a zombie or of the wrong class.
     */
    public <T extends Symbol> T resolveReference(long id, Class<T> type) {
        Symbol symbol = symbols.get(id);
        if (symbol == null) {
            throw SymbolException.unexpected("Reference to symbol %d no longer resolves", id);
        }
        if (!type.isInstance(symbol)) {
            throw SymbolException.unexpected("Reference to symbol %d is a %s, expected %s", id,
                    symbol.getClass().getSimpleName(), type.getSimpleName());
        }
        return type.cast(symbol);
    }

    // endregion

    // region Lookup

    public OptionalLong findByName(String name) {
        Long id = namedGlobals.get(name);
        return id == null ? OptionalLong.empty() : OptionalLong.of(id);
    }

    /**
     * Finds the symbol owning a module offset.
     *
     * @param address The module-relative address.
     * @param exactOnly If set, only a match whose base offset equals {@code address} is reported.
     * @return The owning symbol and the residual offset, or empty.
     */
    public Optional<OffsetMatch> findByOffset(long address, boolean exactOnly) {
        LongList owners = rangeIndex.query(address);
        if (!owners.isEmpty()) {
            long ownerId = owners.getLong(0);
            Symbol owner = resolveReference(ownerId, Symbol.class);
            long base = (owner instanceof HasOffset located) ? located.offset() : address;
            long residual = address - base;
            if (exactOnly && residual != 0) {
                return Optional.empty();
            }
            return Optional.of(new OffsetMatch(ownerId, residual));
        }

        LongList publics = publicIndex.findAt(address);
        if (!publics.isEmpty()) {
            return Optional.of(new OffsetMatch(publics.getLong(0), 0));
        }
        return Optional.empty();
    }

    public AddressRangeIndex rangeIndex() {
        return rangeIndex;
    }

    public AddressPointIndex publicIndex() {
        return publicIndex;
    }

    // endregion

    // region Dependencies

    public void addDependentNotify(long dependencyId, long dependentId) {
        dependencies.add(dependencyId, dependentId);
    }

    public boolean removeDependentNotify(long dependencyId, long dependentId) {
        return dependencies.remove(dependencyId, dependentId);
    }

    public int dependentCount(long dependencyId, long dependentId) {
        return dependencies.count(dependencyId, dependentId);
    }

    public LongList dependentsOf(long dependencyId) {
        return dependencies.dependentsOf(dependencyId);
    }

    /**
     * Recomputes the symbol's own derived state and then notifies everything depending on it, recursively.
     * Ids that no longer resolve are skipped. A true dependency cycle recurses without bound.
     *
     * @param id The symbol that changed.
     */
    public void notifyDependentChange(long id) {
        Symbol symbol = symbols.get(id);
        if (symbol == null) {
            return;
        }
        symbol.recompute();
        for (long dependentId : dependencies.dependentsOf(id)) {
            notifyDependentChange(dependentId);
        }
    }

    // endregion

    // region Structure

    /**
     * Moves a child within its parent and notifies the parent.
     */
    public void moveChildBefore(long parentId, long childId, long position, SymbolKind relativeKind) {
        Symbol parent = require(parentId);
        parent.moveChildBefore(childId, position, relativeKind);
        notifyDependentChange(parentId);
        invalidateExternalCaches();
    }

    /**
     * Enumerates the children of a symbol, optionally filtered. The stream is restartable by calling again.
     *
     * @param parentId The parent symbol.
     * @param kind Only children of this kind, or {@code null} for all.
     * @param name Only children with this name, or {@code null} for all.
     * @throws SymbolException {@code UNEXPECTED} while consuming if a child id no longer resolves.
     */
    public Stream<Symbol> children(long parentId, SymbolKind kind, String name) {
        LongList childIds = new LongArrayList(require(parentId).childIds());
        return childIds.stream()
                .map(childId -> resolveReference(childId, Symbol.class))
                .filter(child -> kind == null || child.kind() == kind)
                .filter(child -> name == null || name.equals(child.name()));
    }

    public <T extends Symbol> Stream<T> children(long parentId, SymbolKind kind, Class<T> type) {
        return children(parentId, kind, (String) null).map(child -> resolveReference(child.id(), type));
    }

    /**
     * @return Every live symbol in id order.
     */
    public Stream<Symbol> symbols() {
        return List.copyOf(symbols.values()).stream();
    }

    /**
     * @return Every live global symbol (types, functions, data) in id order.
     */
    public Stream<Symbol> globalSymbols() {
        return new LongArrayList(globalIds).stream().map(symbols::get).filter(Objects::nonNull);
    }

    public int size() {
        return symbols.size();
    }

    // endregion

    // region Invalidation

    public void addListener(CacheInvalidationListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(CacheInvalidationListener listener) {
        listeners.remove(listener);
    }

    /**
     * Tells every listener that cached views of this store are stale. A failing listener is logged and
     * never fails the mutation that triggered the broadcast.
     */
    public void invalidateExternalCaches() {
        for (CacheInvalidationListener listener : listeners) {
            try {
                listener.symbolsChanged();
            } catch (RuntimeException e) {
                LOG.warn("Cache invalidation listener failed: {}", e.getMessage());
            }
        }
    }

    // endregion
}
