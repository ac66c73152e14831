package org.symforge.model;

/**
 * Capability of symbols that have a position: a module offset for functions, data and publics, or an
 * offset within the owning type for members.
 */
public interface HasOffset {

    /**
     * @return The effective offset of the symbol.
     */
    long offset();
}
