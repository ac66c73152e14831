package org.symforge.importer;

/**
 * The lookups that give an importer a chance to populate symbols first.
 */
public enum ImportQueryKind {
    OFFSET,
    NAME,
    REGEX
}
