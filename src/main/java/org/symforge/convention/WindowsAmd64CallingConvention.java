package org.symforge.convention;

import org.symforge.arch.Location;
import org.symforge.arch.RegisterCatalog;
import org.symforge.model.SymbolStore;

import java.util.ArrayList;
import java.util.List;

/**
 * The Microsoft x64 calling convention. The first four parameters go to {@code rcx, rdx, r8, r9} or
 * {@code xmm0-xmm3} by position; the rest go to the stack above the return address and the 0x20 byte
 * home area.
 */
public class WindowsAmd64CallingConvention extends CallingConvention {

    private static final List<String> NON_VOLATILES =
            List.of("r12", "r13", "r14", "r15", "rdi", "rsi", "rbx", "rbp", "rsp");
    private static final List<String> ORDINAL_PARAMETERS = List.of("rcx", "rdx", "r8", "r9");
    private static final List<String> FLOATING_PARAMETERS = List.of("xmm0", "xmm1", "xmm2", "xmm3");

    private static final long RETURN_ADDRESS_SIZE = 8;
    private static final long HOME_AREA_SIZE = 0x20;
    private static final long STACK_SLOT_SIZE = 8;

    private final List<Integer> ordinalIds;
    private final List<Integer> floatingIds;
    private final int stackPointerId;

    public WindowsAmd64CallingConvention(RegisterCatalog registers) {
        super(registers, NON_VOLATILES);
        this.ordinalIds = resolveRegisters(ORDINAL_PARAMETERS);
        this.floatingIds = resolveRegisters(FLOATING_PARAMETERS);
        this.stackPointerId = resolveRegister("rsp");
    }

    @Override
    public List<Location> placeParameters(SymbolStore store, List<Long> parameterTypeIds) {
        List<Location> locations = new ArrayList<>(parameterTypeIds.size());
        long stackOffset = RETURN_ADDRESS_SIZE + HOME_AREA_SIZE;

        for (int i = 0; i < parameterTypeIds.size(); i++) {
            ParameterShape shape = ParameterShape.of(store, parameterTypeIds.get(i));
            if (i < ordinalIds.size()) {
                int registerId = shape.floating() ? floatingIds.get(i) : ordinalIds.get(i);
                locations.add(placeInRegister(registerId, shape.size()));
            } else {
                locations.add(Location.registerRelative(stackPointerId, stackOffset));
                stackOffset += Math.max(STACK_SLOT_SIZE, roundUp(shape.size(), STACK_SLOT_SIZE));
            }
        }
        return locations;
    }

    private Location placeInRegister(int registerId, long valueSize) {
        int capacity = registers().findById(registerId).map(r -> r.size()).orElse(0);
        if (valueSize > capacity) {
            // passed by reference
            return Location.registerRelative(registerId, 0);
        }
        return Location.register(registers().viewForValue(registerId, valueSize));
    }

    private static long roundUp(long value, long alignment) {
        long remainder = value % alignment;
        return remainder == 0 ? value : value + (alignment - remainder);
    }
}
