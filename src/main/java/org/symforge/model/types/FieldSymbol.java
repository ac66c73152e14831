package org.symforge.model.types;

import org.symforge.model.SymbolKind;

/**
 * A data member of a user defined type.
 */
public class FieldSymbol extends PositionalMemberSymbol {

    public FieldSymbol(long ownerId, String name, long typeId, Long offset) {
        super(SymbolKind.FIELD, ownerId, name, typeId, offset);
    }
}
