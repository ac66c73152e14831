package org.symforge.api;

/**
 * A public (exported) name at a module offset.
 */
public record PublicInfo(long id, String name, String qualifiedName, long offset) {
}
