package org.symforge.api;

import org.symforge.model.types.IntrinsicKind;
import org.symforge.model.types.PointerKind;
import org.symforge.model.types.TypeKind;

/**
 * The computed state of a type.
 *
 * @param id The type id.
 * @param name The type name.
 * @param qualifiedName The qualified name, or null.
 * @param typeKind The variant of the type.
 * @param size The size in bytes.
 * @param alignment The alignment in bytes.
 * @param baseTypeId The pointee, element, typedef target or enum underlying type; 0 for other kinds.
 * @param intrinsicKind The intrinsic kind of a basic type, otherwise null.
 * @param pointerKind The pointer kind of a pointer type, otherwise null.
 * @param dimension The element count of an array type, otherwise 0.
 */
public record TypeInfo(long id, String name, String qualifiedName, TypeKind typeKind, long size, long alignment,
                       long baseTypeId, IntrinsicKind intrinsicKind, PointerKind pointerKind, long dimension) {
}
