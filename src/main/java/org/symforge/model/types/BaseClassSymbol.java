package org.symforge.model.types;

import org.symforge.model.SymbolKind;

/**
 * A base class subobject of a user defined type. The name is the base type's name.
 */
public class BaseClassSymbol extends PositionalMemberSymbol {

    public BaseClassSymbol(long ownerId, String baseTypeName, long baseTypeId, Long offset) {
        super(SymbolKind.BASE_CLASS, ownerId, baseTypeName, baseTypeId, offset);
    }
}
