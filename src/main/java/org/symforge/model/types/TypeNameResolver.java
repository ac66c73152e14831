package org.symforge.model.types;

import org.symforge.model.Symbol;
import org.symforge.model.SymbolException;
import org.symforge.model.SymbolStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.OptionalLong;

/**
 * Resolves textual type names, creating pointer and array types on demand when the name ends in
 * {@code *}, {@code &}, {@code &&}, {@code ^} or {@code [N]} and the base name resolves.
 */
public final class TypeNameResolver {

    private static final Logger LOG = LoggerFactory.getLogger(TypeNameResolver.class);

    private final SymbolStore store;
    private final boolean demandCreatePointerTypes;
    private final boolean demandCreateArrayTypes;

    public TypeNameResolver(SymbolStore store, boolean demandCreatePointerTypes, boolean demandCreateArrayTypes) {
        this.store = store;
        this.demandCreatePointerTypes = demandCreatePointerTypes;
        this.demandCreateArrayTypes = demandCreateArrayTypes;
    }

    /**
     * @param typeName The name to resolve, e.g. {@code "Foo"}, {@code "int*"} or {@code "Foo [4]"}.
     * @return The id of the existing or newly created type.
     * @throws SymbolException {@code NOT_FOUND} for an unknown base name, {@code INVALID_ARGUMENT} for
     *                         malformed syntax or a non-type match, {@code UNSUPPORTED} if the needed
     *                         demand creation is disabled.
     */
    public long resolve(String typeName) {
        if (typeName == null) {
            throw SymbolException.invalidArgument("Type name is null");
        }
        String name = typeName.trim();
        if (name.isEmpty()) {
            throw SymbolException.invalidArgument("Empty type name");
        }

        OptionalLong existing = store.findByName(name);
        if (existing.isPresent()) {
            Symbol symbol = store.require(existing.getAsLong());
            if (!(symbol instanceof TypeSymbol)) {
                throw SymbolException.invalidArgument("'%s' names a %s, not a type", name, symbol.kind());
            }
            return symbol.id();
        }

        if (name.endsWith("]")) {
            return resolveArray(name);
        }

        PointerKind pointerKind = pointerSuffixOf(name);
        if (pointerKind != null) {
            return resolvePointer(name, pointerKind);
        }

        throw SymbolException.notFound("No type named '%s'", name);
    }

    private long resolveArray(String name) {
        int open = name.lastIndexOf('[');
        if (open < 0) {
            throw SymbolException.invalidArgument("Unbalanced array suffix in '%s'", name);
        }
        String digits = name.substring(open + 1, name.length() - 1).trim();
        if (digits.isEmpty() || !digits.chars().allMatch(Character::isDigit)) {
            throw SymbolException.invalidArgument("Invalid array dimension '%s' in '%s'", digits, name);
        }
        long dimension;
        try {
            dimension = Long.parseLong(digits);
        } catch (NumberFormatException e) {
            throw SymbolException.invalidArgument("Array dimension out of range in '%s'", name);
        }
        String baseName = requireBaseName(name.substring(0, open), name);
        if (!demandCreateArrayTypes) {
            throw SymbolException.unsupported("Demand creation of array types is disabled ('%s')", name);
        }

        long elementId = resolve(baseName);
        String canonical = store.require(elementId).name() + "[" + dimension + "]";
        OptionalLong existing = store.findByName(canonical);
        if (existing.isPresent() && store.require(existing.getAsLong()) instanceof ArrayTypeSymbol) {
            return existing.getAsLong();
        }
        LOG.debug("Creating array type '{}'", canonical);
        return store.add(new ArrayTypeSymbol(canonical, elementId, dimension));
    }

    private long resolvePointer(String name, PointerKind pointerKind) {
        String baseName = requireBaseName(name.substring(0, name.length() - pointerKind.suffix().length()), name);
        if (!demandCreatePointerTypes) {
            throw SymbolException.unsupported("Demand creation of pointer types is disabled ('%s')", name);
        }

        long pointeeId = resolve(baseName);
        String canonical = store.require(pointeeId).name() + pointerKind.suffix();
        OptionalLong existing = store.findByName(canonical);
        if (existing.isPresent() && store.require(existing.getAsLong()) instanceof PointerTypeSymbol) {
            return existing.getAsLong();
        }
        LOG.debug("Creating pointer type '{}'", canonical);
        return store.add(new PointerTypeSymbol(canonical, pointeeId, pointerKind));
    }

    private static PointerKind pointerSuffixOf(String name) {
        if (name.endsWith("&&")) {
            return PointerKind.RVALUE_REFERENCE;
        }
        if (name.endsWith("&")) {
            return PointerKind.REFERENCE;
        }
        if (name.endsWith("*")) {
            return PointerKind.STANDARD;
        }
        if (name.endsWith("^")) {
            return PointerKind.CX_HAT;
        }
        return null;
    }

    private static String requireBaseName(String base, String fullName) {
        String trimmed = base.trim();
        if (trimmed.isEmpty()) {
            throw SymbolException.invalidArgument("Missing base type in '%s'", fullName);
        }
        return trimmed;
    }
}
