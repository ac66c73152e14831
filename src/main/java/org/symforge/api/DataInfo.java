package org.symforge.api;

/**
 * A global variable.
 */
public record DataInfo(long id, String name, String qualifiedName, long typeId, long offset, long size) {
}
