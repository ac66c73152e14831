package org.symforge.model.types;

import org.symforge.model.Symbol;
import org.symforge.model.SymbolKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A user defined type (struct, class, union). Its children are base classes and fields; layout places
 * every base class before any field regardless of declaration order.
 */
public class UdtTypeSymbol extends TypeSymbol {

    private static final Logger LOG = LoggerFactory.getLogger(UdtTypeSymbol.class);
    private static final SymbolKind[] LAYOUT_PASSES = {SymbolKind.BASE_CLASS, SymbolKind.FIELD};

    public UdtTypeSymbol(String name, String qualifiedName) {
        super(name, qualifiedName);
    }

    @Override
    public TypeKind typeKind() {
        return TypeKind.UDT;
    }

    @Override
    protected void recompute() {
        layout();
    }

    /**
     * Computes member offsets, the type size and the type alignment. Members with an explicit offset are
     * placed there unconditionally; automatic members are appended at the next suitably aligned offset.
     */
    public void layout() {
        long typeSize = 0;
        long cursor = 0;
        long maxAlignment = 1;

        for (SymbolKind pass : LAYOUT_PASSES) {
            for (long childId : childIds()) {
                Symbol child = store().resolveReference(childId, Symbol.class);
                if (child.kind() != pass || !(child instanceof PositionalMemberSymbol member)) {
                    continue;
                }

                TypeSymbol memberType = store().resolveReference(member.typeId(), TypeSymbol.class);
                long memberAlignment = memberType.alignment();
                maxAlignment = Math.max(maxAlignment, memberAlignment);

                long offset;
                if (member.isAutomaticLayout()) {
                    offset = roundUp(cursor, memberAlignment);
                    member.setComputedOffset(offset);
                } else {
                    offset = member.declaredOffset();
                }

                cursor = offset + memberType.size();
                typeSize = Math.max(typeSize, cursor);
            }
        }

        size = roundUp(typeSize, maxAlignment);
        alignment = maxAlignment;
        LOG.debug("Laid out '{}': size {}, alignment {}", name(), size, alignment);
    }
}
