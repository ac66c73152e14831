package org.symforge.model.types;

import java.util.List;

/**
 * The structural type of a function: a return type and ordered parameter types. Instances are interned
 * per signature and carry no name.
 */
public class FunctionTypeSymbol extends TypeSymbol {

    private final Signature signature;

    public FunctionTypeSymbol(Signature signature) {
        super(null, null);
        this.signature = signature;
    }

    @Override
    public TypeKind typeKind() {
        return TypeKind.FUNCTION;
    }

    public long returnTypeId() {
        return signature.returnTypeId();
    }

    public List<Long> parameterTypeIds() {
        return signature.parameterTypeIds();
    }

    public Signature signature() {
        return signature;
    }

    /**
     * The interning key of a function type.
     *
     * @param returnTypeId The return type id, 0 for none.
     * @param parameterTypeIds The parameter type ids in declaration order.
     */
    public record Signature(long returnTypeId, List<Long> parameterTypeIds) {
        public Signature {
            parameterTypeIds = List.copyOf(parameterTypeIds);
        }
    }
}
