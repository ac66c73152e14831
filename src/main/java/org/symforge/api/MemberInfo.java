package org.symforge.api;

import org.symforge.model.SymbolKind;

/**
 * A field or base class of a user defined type.
 *
 * @param id The member id.
 * @param kind {@link SymbolKind#FIELD} or {@link SymbolKind#BASE_CLASS}.
 * @param ownerId The owning type.
 * @param name The member name, for a base class the base type name.
 * @param typeId The member type.
 * @param offset The computed offset within the owner.
 * @param automaticLayout Whether the offset is computed by layout.
 */
public record MemberInfo(long id, SymbolKind kind, long ownerId, String name, long typeId, long offset,
                         boolean automaticLayout) {
}
