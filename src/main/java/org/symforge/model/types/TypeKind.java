package org.symforge.model.types;

/**
 * The closed set of type symbol variants.
 */
public enum TypeKind {
    INTRINSIC,
    UDT,
    POINTER,
    ARRAY,
    TYPEDEF,
    ENUM,
    FUNCTION
}
