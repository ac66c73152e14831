package org.symforge.model;

/**
 * Receives a best-effort notification whenever the contents of a symbol store change.
 */
@FunctionalInterface
public interface CacheInvalidationListener {

    void symbolsChanged();
}
