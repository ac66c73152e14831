package org.symforge.model.functions;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A position inside a function. The variable views are captured when the scope is resolved, so a scope
 * stays readable after its function is edited or deleted, and two scopes never share bound-variable state.
 */
public final class Scope {

    private final long functionId;
    private final String functionName;
    private final long functionOffset;
    private final List<BoundVariable> declaredVariables;

    private Scope(long functionId, String functionName, long functionOffset, List<BoundVariable> declaredVariables) {
        this.functionId = functionId;
        this.functionName = functionName;
        this.functionOffset = functionOffset;
        this.declaredVariables = List.copyOf(declaredVariables);
    }

    static Scope capture(FunctionSymbol function, long functionOffset) {
        List<BoundVariable> declared = new ArrayList<>();
        for (VariableSymbol parameter : function.parameters()) {
            declared.add(BoundVariable.bind(parameter, functionOffset));
        }
        for (VariableSymbol local : function.locals()) {
            declared.add(BoundVariable.bind(local, functionOffset));
        }
        return new Scope(function.id(), function.name(), functionOffset, declared);
    }

    public long functionId() {
        return functionId;
    }

    public String functionName() {
        return functionName;
    }

    /**
     * @return The offset relative to the start of the function's primary range.
     */
    public long functionOffset() {
        return functionOffset;
    }

    /**
     * @return Parameters then locals whose live ranges cover this scope's offset.
     */
    public List<BoundVariable> variables() {
        return declaredVariables.stream().filter(BoundVariable::isLive).collect(Collectors.toList());
    }

    /**
     * @return All parameters then all locals, bound to their location at this offset (possibly none).
     */
    public List<BoundVariable> declaredVariables() {
        return new ArrayList<>(declaredVariables);
    }

    @Override
    public String toString() {
        return String.format("%s+%#x", functionName, functionOffset);
    }
}
