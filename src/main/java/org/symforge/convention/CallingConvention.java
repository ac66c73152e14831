package org.symforge.convention;

import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import org.symforge.arch.Location;
import org.symforge.arch.RegisterCatalog;
import org.symforge.arch.RegisterInfo;
import org.symforge.model.SymbolException;
import org.symforge.model.SymbolStore;
import org.symforge.model.functions.FunctionSymbol;
import org.symforge.model.functions.VariableSymbol;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Knowledge of where a platform ABI passes parameters and which registers survive a call.
 * <p>
 * Register names are resolved to canonical ids once, at construction.
 */
public abstract class CallingConvention {

    private final RegisterCatalog registers;
    private final IntSet nonVolatiles = new IntOpenHashSet();

    /**
     * @param registers The register catalog of the target architecture.
     * @param nonVolatileNames The names of the registers preserved across calls.
     * @throws SymbolException {@code UNSUPPORTED} if a name is unknown to the catalog.
     */
    protected CallingConvention(RegisterCatalog registers, List<String> nonVolatileNames) {
        this.registers = registers;
        for (String name : nonVolatileNames) {
            nonVolatiles.add(registers.wholeRegisterOf(resolveRegister(name)));
        }
    }

    public RegisterCatalog registers() {
        return registers;
    }

    /**
     * @param registerId Any register or sub-register id.
     * @return {@code true} if the whole register owning the id is preserved across calls.
     */
    public boolean isNonVolatile(int registerId) {
        return nonVolatiles.contains(registers.wholeRegisterOf(registerId));
    }

    /**
     * Computes the entry location of each parameter, left to right.
     *
     * @param store The store holding the parameter types.
     * @param parameterTypeIds The parameter types in declaration order.
     * @return One location per parameter, {@link Location#none()} where the convention has no answer.
     */
    public abstract List<Location> placeParameters(SymbolStore store, List<Long> parameterTypeIds);

    /**
     * Convenience overload placing the current parameters of a function.
     */
    public List<Location> placeParameters(SymbolStore store, FunctionSymbol function) {
        List<Long> typeIds = function.parameters().stream()
                .map(VariableSymbol::typeId)
                .collect(Collectors.toList());
        return placeParameters(store, typeIds);
    }

    protected final int resolveRegister(String name) {
        return registers.findByName(name)
                .map(RegisterInfo::id)
                .orElseThrow(() -> SymbolException.unsupported("Register '%s' is unknown to the architecture", name));
    }

    protected final List<Integer> resolveRegisters(List<String> names) {
        List<Integer> ids = new ArrayList<>(names.size());
        for (String name : names) {
            ids.add(resolveRegister(name));
        }
        return ids;
    }
}
