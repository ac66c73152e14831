package org.symforge.api;

/**
 * Defines the failure kinds reported by every public symbol builder operation.
 * Callers branch on these codes rather than on exception messages.
 */
public enum SymbolErrorCode {
    // region Lookup Errors
    /** A name, offset or id lookup did not match anything, or the id no longer resolves. */
    NOT_FOUND,
    // endregion

    // region Caller Errors
    /**
     * An argument was rejected: malformed type-name syntax, an offset outside the function bounds,
     * overlapping live ranges for the same variable, a non-ordinal enum base type and similar.
     */
    INVALID_ARGUMENT,
    /** The requested behavior is not available: architecture or calling-convention gap, disabled demand creation. */
    UNSUPPORTED,
    // endregion

    // region Internal Errors
    /** The symbol graph violated one of its own invariants, e.g. a reference to a missing or wrong-kind id. */
    UNEXPECTED,
    /** The secondary symbol source could not import; never fatal to a lookup. */
    IMPORT_FAILURE
    // endregion
}
