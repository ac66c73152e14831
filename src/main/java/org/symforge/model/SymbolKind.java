package org.symforge.model;

/**
 * The kind tag of every symbol in a symbol set.
 */
public enum SymbolKind {
    TYPE(true),
    FIELD(false),
    BASE_CLASS(false),
    DATA(true),
    FUNCTION(true),
    PARAMETER(false),
    LOCAL(false),
    PUBLIC(false);

    private final boolean global;

    SymbolKind(boolean global) {
        this.global = global;
    }

    /**
     * @return {@code true} if symbols of this kind are indexed by name at the top level of the set.
     */
    public boolean isGlobal() {
        return global;
    }
}
