package org.symforge.model;

/**
 * Capability of symbols that refer to a type symbol by id.
 */
public interface HasType {

    /**
     * @return The id of the symbol's type, or 0 if it has none.
     */
    long typeId();
}
