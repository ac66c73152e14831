package org.symforge.api;

/**
 * An enumerant with its computed value.
 */
public record EnumerantInfo(long id, long enumId, String name, long typeId, long value, boolean autoIncrement) {
}
