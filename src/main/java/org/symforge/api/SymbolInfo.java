package org.symforge.api;

import org.symforge.model.SymbolKind;

import java.util.List;

/**
 * The common view of any symbol.
 *
 * @param id The symbol id.
 * @param kind The symbol kind.
 * @param name The name, possibly null for unnamed symbols.
 * @param qualifiedName The qualified name, or null.
 * @param parentId The owning symbol, 0 for globals.
 * @param childIds The owned symbols in order.
 */
public record SymbolInfo(long id, SymbolKind kind, String name, String qualifiedName, long parentId, List<Long> childIds) {

    public SymbolInfo {
        childIds = List.copyOf(childIds);
    }
}
