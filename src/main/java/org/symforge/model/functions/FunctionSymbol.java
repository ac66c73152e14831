package org.symforge.model.functions;

import org.symforge.model.HasOffset;
import org.symforge.model.Symbol;
import org.symforge.model.SymbolException;
import org.symforge.model.SymbolKind;
import org.symforge.model.SymbolStore;
import org.symforge.model.types.FunctionTypeSymbol;
import org.symforge.model.types.TypeSymbol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A function occupying one or more disjoint code ranges. The first range is the primary one and holds
 * the entry point; live range offsets of the function's variables are relative to its start.
 */
public class FunctionSymbol extends Symbol implements HasOffset {

    private final List<AddressRange> ranges = new ArrayList<>();
    private long returnTypeId;
    private long functionTypeId;

    /**
     * @param returnTypeId The return type, or 0 for none.
     */
    public FunctionSymbol(String name, String qualifiedName, long returnTypeId, long offset, long size) {
        super(SymbolKind.FUNCTION, 0, name, qualifiedName);
        if (name == null || name.isBlank()) {
            throw SymbolException.invalidArgument("Function requires a name");
        }
        requirePositive(size);
        this.returnTypeId = returnTypeId;
        this.ranges.add(new AddressRange(offset, size));
    }

    @Override
    protected void validate(SymbolStore store) {
        requireReturnType(store, returnTypeId);
    }

    @Override
    protected void onAttach() {
        for (AddressRange range : ranges) {
            store().rangeIndex().insert(range.offset(), range.end(), id());
        }
    }

    @Override
    protected void recompute() {
        functionTypeId = 0;
    }

    @Override
    protected void onDelete() {
        for (AddressRange range : ranges) {
            store().rangeIndex().remove(range.offset(), range.end(), id());
        }
    }

    /**
     * @return The start of the primary range.
     */
    @Override
    public long offset() {
        return ranges.get(0).offset();
    }

    public List<AddressRange> ranges() {
        return Collections.unmodifiableList(ranges);
    }

    public long returnTypeId() {
        return returnTypeId;
    }

    public void addRange(long offset, long size) {
        requirePositive(size);
        for (AddressRange existing : ranges) {
            if (existing.overlaps(offset, size)) {
                throw SymbolException.invalidArgument("Range [%#x, +%#x) overlaps existing range of '%s'", offset, size, name());
            }
        }
        ranges.add(new AddressRange(offset, size));
        store().rangeIndex().insert(offset, offset + size, id());
        changed();
    }

    public void removeRange(long offset, long size) {
        AddressRange range = new AddressRange(offset, size);
        if (!ranges.contains(range)) {
            throw SymbolException.notFound("Function '%s' has no range [%#x, +%#x)", name(), offset, size);
        }
        if (ranges.size() == 1) {
            throw SymbolException.invalidArgument("Cannot remove the only range of '%s'", name());
        }
        ranges.remove(range);
        store().rangeIndex().remove(offset, offset + size, id());
        changed();
    }

    public void setReturnType(long typeId) {
        requireReturnType(store(), typeId);
        returnTypeId = typeId;
        changed();
    }

    /**
     * Returns the structural function type for the current return type and parameter list, creating it
     * the first time a signature is seen.
     *
     * @return The function type id.
     */
    public long functionType() {
        if (functionTypeId != 0 && store().contains(functionTypeId)) {
            return functionTypeId;
        }
        List<Long> parameterTypes = parameters().stream()
                .map(VariableSymbol::typeId)
                .collect(Collectors.toList());
        FunctionTypeSymbol.Signature signature = new FunctionTypeSymbol.Signature(returnTypeId, parameterTypes);
        functionTypeId = store().intern(signature, () -> new FunctionTypeSymbol(signature));
        return functionTypeId;
    }

    /**
     * @return The parameters in declaration order.
     */
    public List<VariableSymbol> parameters() {
        return store().children(id(), SymbolKind.PARAMETER, VariableSymbol.class).collect(Collectors.toList());
    }

    /**
     * @return The locals in declaration order.
     */
    public List<VariableSymbol> locals() {
        return store().children(id(), SymbolKind.LOCAL, VariableSymbol.class).collect(Collectors.toList());
    }

    /**
     * Converts a module offset inside one of the function's ranges to a function-relative offset.
     */
    public long toFunctionOffset(long moduleOffset) {
        return moduleOffset - offset();
    }

    /**
     * @return The function's ranges expressed relative to the primary range start.
     */
    public List<AddressRange> relativeRanges() {
        long base = offset();
        List<AddressRange> relative = new ArrayList<>(ranges.size());
        for (AddressRange range : ranges) {
            relative.add(new AddressRange(range.offset() - base, range.size()));
        }
        return relative;
    }

    private static void requirePositive(long size) {
        if (size <= 0) {
            throw SymbolException.invalidArgument("Function range size must be positive: %d", size);
        }
    }

    private static void requireReturnType(SymbolStore store, long typeId) {
        if (typeId != 0 && !(store.require(typeId) instanceof TypeSymbol)) {
            throw SymbolException.invalidArgument("Return type %d is not a type", typeId);
        }
    }
}
