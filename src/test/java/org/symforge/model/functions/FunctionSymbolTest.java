package org.symforge.model.functions;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.symforge.api.SymbolErrorCode;
import org.symforge.model.SymbolException;
import org.symforge.model.SymbolKind;
import org.symforge.model.SymbolStore;
import org.symforge.model.types.BasicCTypes;
import org.symforge.model.types.FunctionTypeSymbol;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Tag("unit")
class FunctionSymbolTest {

    private SymbolStore store;
    private long intId;
    private long doubleId;

    @BeforeEach
    void setUp() {
        store = new SymbolStore(8);
        BasicCTypes.addTo(store);
        intId = store.findByName("int").getAsLong();
        doubleId = store.findByName("double").getAsLong();
    }

    @Test
    @DisplayName("A function is found by any offset inside its ranges")
    void ranges_areIndexed() {
        long fnId = store.add(new FunctionSymbol("main", null, intId, 0x1000, 0x40));
        FunctionSymbol function = store.require(fnId, FunctionSymbol.class);
        function.addRange(0x3000, 0x10);

        assertEquals(2, function.ranges().size());
        assertEquals(fnId, store.findByOffset(0x1020, false).get().symbolId());
        assertEquals(0x20, store.findByOffset(0x1020, false).get().residual());
        assertEquals(fnId, store.findByOffset(0x3008, false).get().symbolId());
        assertTrue(store.findByOffset(0x1020, true).isEmpty());
        assertThat(function.relativeRanges()).containsExactly(new AddressRange(0, 0x40), new AddressRange(0x2000, 0x10));
    }

    @Test
    @DisplayName("Overlapping ranges are rejected and the only range cannot be removed")
    void ranges_validated() {
        long fnId = store.add(new FunctionSymbol("main", null, 0, 0x1000, 0x40));
        FunctionSymbol function = store.require(fnId, FunctionSymbol.class);

        assertCode(SymbolErrorCode.INVALID_ARGUMENT, () -> function.addRange(0x1030, 0x20));
        assertCode(SymbolErrorCode.INVALID_ARGUMENT, () -> function.removeRange(0x1000, 0x40));
        assertCode(SymbolErrorCode.NOT_FOUND, () -> function.removeRange(0x2000, 0x10));
        assertCode(SymbolErrorCode.INVALID_ARGUMENT, () -> function.addRange(0x2000, 0));
    }

    @Test
    @DisplayName("Removing a secondary range drops it from the address index")
    void removeRange_unindexes() {
        long fnId = store.add(new FunctionSymbol("main", null, 0, 0x1000, 0x40));
        FunctionSymbol function = store.require(fnId, FunctionSymbol.class);
        function.addRange(0x3000, 0x10);

        function.removeRange(0x3000, 0x10);

        assertTrue(store.findByOffset(0x3008, false).isEmpty());
        assertEquals(1, function.ranges().size());
    }

    @Test
    @DisplayName("The function type is interned per signature and follows parameter changes")
    void functionType_tracksSignature() {
        long f = store.add(new FunctionSymbol("f", null, intId, 0x1000, 0x10));
        long g = store.add(new FunctionSymbol("g", null, intId, 0x2000, 0x10));
        long p = store.add(new VariableSymbol(SymbolKind.PARAMETER, f, "a", intId));
        store.add(new VariableSymbol(SymbolKind.PARAMETER, g, "b", intId));
        FunctionSymbol function = store.require(f, FunctionSymbol.class);

        long typeId = function.functionType();
        assertEquals(typeId, store.require(g, FunctionSymbol.class).functionType());
        FunctionTypeSymbol type = store.require(typeId, FunctionTypeSymbol.class);
        assertEquals(intId, type.returnTypeId());
        assertEquals(List.of(intId), type.parameterTypeIds());

        store.require(p, VariableSymbol.class).setType(doubleId);
        long changed = function.functionType();
        assertNotEquals(typeId, changed);
        assertEquals(List.of(doubleId), store.require(changed, FunctionTypeSymbol.class).parameterTypeIds());

        function.setReturnType(0);
        assertEquals(0, store.require(function.functionType(), FunctionTypeSymbol.class).returnTypeId());
    }

    @Test
    @DisplayName("Parameters keep declaration order and can be reordered")
    void parameters_reorder() {
        long f = store.add(new FunctionSymbol("f", null, 0, 0x1000, 0x10));
        long a = store.add(new VariableSymbol(SymbolKind.PARAMETER, f, "a", intId));
        long local = store.add(new VariableSymbol(SymbolKind.LOCAL, f, "tmp", intId));
        long b = store.add(new VariableSymbol(SymbolKind.PARAMETER, f, "b", doubleId));
        FunctionSymbol function = store.require(f, FunctionSymbol.class);
        long before = function.functionType();

        store.require(b, VariableSymbol.class).moveToBefore(0);

        assertThat(function.parameters()).extracting(VariableSymbol::id).containsExactly(b, a);
        assertThat(function.locals()).extracting(VariableSymbol::id).containsExactly(local);
        assertEquals(List.of(doubleId, intId),
                store.require(function.functionType(), FunctionTypeSymbol.class).parameterTypeIds());
        assertNotEquals(before, function.functionType());
        assertCode(SymbolErrorCode.INVALID_ARGUMENT, () -> store.require(local, VariableSymbol.class).moveToBefore(0));
    }

    private static void assertCode(SymbolErrorCode expected, Runnable call) {
        SymbolException e = assertThrows(SymbolException.class, call::run);
        assertEquals(expected, e.getCode());
    }
}
