package org.symforge.model.types;

/**
 * Pointer flavors and the suffix that spells each of them in a type name.
 */
public enum PointerKind {
    STANDARD("*"),
    REFERENCE("&"),
    RVALUE_REFERENCE("&&"),
    CX_HAT("^");

    private final String suffix;

    PointerKind(String suffix) {
        this.suffix = suffix;
    }

    public String suffix() {
        return suffix;
    }
}
