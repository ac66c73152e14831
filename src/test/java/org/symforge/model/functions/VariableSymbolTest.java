package org.symforge.model.functions;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.symforge.api.SymbolErrorCode;
import org.symforge.arch.Location;
import org.symforge.model.SymbolException;
import org.symforge.model.SymbolKind;
import org.symforge.model.SymbolStore;
import org.symforge.model.types.BasicCTypes;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Live range bookkeeping of parameters and locals.
 */
@Tag("unit")
class VariableSymbolTest {

    private static final Location RCX = Location.register(330);
    private static final Location STACK = Location.registerRelative(335, 0x28);

    private SymbolStore store;
    private long functionId;
    private VariableSymbol parameter;

    @BeforeEach
    void setUp() {
        store = new SymbolStore(8);
        BasicCTypes.addTo(store);
        long intId = store.findByName("int").getAsLong();
        functionId = store.add(new FunctionSymbol("f", null, 0, 0x1000, 0x40));
        long parameterId = store.add(new VariableSymbol(SymbolKind.PARAMETER, functionId, "a", intId));
        parameter = store.require(parameterId, VariableSymbol.class);
    }

    @Test
    @DisplayName("Live ranges get per-variable ids and are listed by offset")
    void addLiveRange_assignsIds() {
        long second = parameter.addLiveRange(0x20, 0x20, STACK);
        long first = parameter.addLiveRange(0, 0x10, RCX);

        assertEquals(1, second);
        assertEquals(2, first);
        assertThat(parameter.liveRanges()).extracting(LiveRange::id).containsExactly(first, second);
        assertEquals(RCX, parameter.locationAt(0x08));
        assertTrue(parameter.locationAt(0x18).isNone());
        assertEquals(STACK, parameter.locationAt(0x3f));
    }

    @Test
    @DisplayName("Ranges outside the function or overlapping another range are rejected")
    void addLiveRange_validates() {
        parameter.addLiveRange(0, 0x10, RCX);

        assertCode(SymbolErrorCode.INVALID_ARGUMENT, () -> parameter.addLiveRange(0x08, 0x10, STACK));
        assertCode(SymbolErrorCode.INVALID_ARGUMENT, () -> parameter.addLiveRange(0x30, 0x20, STACK));
        assertCode(SymbolErrorCode.INVALID_ARGUMENT, () -> parameter.addLiveRange(0x20, 0, STACK));
        assertCode(SymbolErrorCode.INVALID_ARGUMENT, () -> parameter.addLiveRange(-4, 0x8, STACK));
        assertEquals(1, parameter.liveRanges().size());
    }

    @Test
    @DisplayName("A range may not straddle two ranges of a disjoint function")
    void addLiveRange_singleFunctionRange() {
        store.require(functionId, FunctionSymbol.class).addRange(0x1040, 0x10);

        assertCode(SymbolErrorCode.INVALID_ARGUMENT, () -> parameter.addLiveRange(0x38, 0x10, RCX));
        parameter.addLiveRange(0x40, 0x10, RCX);
        assertEquals(RCX, parameter.locationAt(0x48));
    }

    @Test
    @DisplayName("Editing a range is validated against the other ranges only")
    void setLiveRange_excludesItself() {
        long id = parameter.addLiveRange(0, 0x10, RCX);
        long other = parameter.addLiveRange(0x20, 0x10, STACK);

        parameter.setLiveRangeSize(id, 0x18);
        parameter.setLiveRangeOffset(id, 0x04);
        parameter.setLiveRangeLocation(other, RCX);

        LiveRange edited = parameter.findLiveRange(id).orElseThrow();
        assertEquals(0x04, edited.offset());
        assertEquals(0x18, edited.size());
        assertEquals(RCX, parameter.findLiveRange(other).orElseThrow().location());
        assertCode(SymbolErrorCode.INVALID_ARGUMENT, () -> parameter.setLiveRangeSize(id, 0x20));
        assertCode(SymbolErrorCode.NOT_FOUND, () -> parameter.setLiveRangeOffset(99, 0));
    }

    @Test
    @DisplayName("Deleting ranges removes them individually or all at once")
    void deleteLiveRanges() {
        long id = parameter.addLiveRange(0, 0x10, RCX);
        parameter.addLiveRange(0x20, 0x10, STACK);

        parameter.deleteLiveRange(id);
        assertEquals(1, parameter.liveRanges().size());
        assertCode(SymbolErrorCode.NOT_FOUND, () -> parameter.deleteLiveRange(id));

        parameter.deleteAllLiveRanges();
        assertTrue(parameter.liveRanges().isEmpty());
    }

    @Test
    @DisplayName("The unbound location exists only for one range spanning a single-range function")
    void unboundLocation() {
        assertCode(SymbolErrorCode.NOT_FOUND, parameter::unboundLocation);

        long id = parameter.addLiveRange(0, 0x40, RCX);
        assertEquals(RCX, parameter.unboundLocation());

        parameter.setLiveRangeSize(id, 0x20);
        assertCode(SymbolErrorCode.NOT_FOUND, parameter::unboundLocation);
    }

    @Test
    @DisplayName("Deleting the function leaves no variables behind")
    void deleteFunction_cascades() {
        long id = parameter.id();

        store.delete(functionId);

        assertFalse(store.contains(id));
    }

    private static void assertCode(SymbolErrorCode expected, Runnable call) {
        SymbolException e = assertThrows(SymbolException.class, call::run);
        assertEquals(expected, e.getCode());
    }
}
