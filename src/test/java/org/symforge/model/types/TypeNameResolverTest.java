package org.symforge.model.types;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.symforge.api.SymbolErrorCode;
import org.symforge.model.SymbolException;
import org.symforge.model.SymbolStore;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@Tag("unit")
class TypeNameResolverTest {

    private SymbolStore store;
    private long intId;

    @BeforeEach
    void setUp() {
        store = new SymbolStore(8);
        BasicCTypes.addTo(store);
        intId = store.findByName("int").getAsLong();
    }

    @Test
    @DisplayName("Existing names resolve directly")
    void resolve_existingName() {
        TypeNameResolver resolver = new TypeNameResolver(store, true, true);

        assertEquals(intId, resolver.resolve("int"));
        assertEquals(intId, resolver.resolve("  int "));
    }

    @Test
    @DisplayName("Pointer suffixes create pointer types once and reuse them afterwards")
    void resolve_createsPointerTypes() {
        TypeNameResolver resolver = new TypeNameResolver(store, true, true);

        long pointerId = resolver.resolve("int*");
        long pointerToPointerId = resolver.resolve("int**");

        PointerTypeSymbol pointer = store.require(pointerId, PointerTypeSymbol.class);
        assertEquals(intId, pointer.typeId());
        assertEquals(PointerKind.STANDARD, pointer.pointerKind());
        assertEquals(8, pointer.size());
        assertEquals(pointerId, store.require(pointerToPointerId, PointerTypeSymbol.class).typeId());
        assertEquals(pointerId, resolver.resolve("int *"));
        assertEquals(PointerKind.RVALUE_REFERENCE,
                store.require(resolver.resolve("int&&"), PointerTypeSymbol.class).pointerKind());
        assertEquals(PointerKind.REFERENCE,
                store.require(resolver.resolve("int&"), PointerTypeSymbol.class).pointerKind());
    }

    @Test
    @DisplayName("Array suffixes create arrays of the element type")
    void resolve_createsArrayTypes() {
        TypeNameResolver resolver = new TypeNameResolver(store, true, true);

        long arrayId = resolver.resolve("int [16]");
        ArrayTypeSymbol array = store.require(arrayId, ArrayTypeSymbol.class);

        assertEquals("int[16]", array.name());
        assertEquals(16, array.dimension());
        assertEquals(64, array.size());
        assertEquals(arrayId, resolver.resolve("int[16]"));

        long nestedId = resolver.resolve("int*[2]");
        assertEquals(16, store.require(nestedId, TypeSymbol.class).size());
    }

    @Test
    @DisplayName("Unknown base names are NOT_FOUND")
    void resolve_unknownBase() {
        TypeNameResolver resolver = new TypeNameResolver(store, true, true);

        assertCode(SymbolErrorCode.NOT_FOUND, () -> resolver.resolve("Missing"));
        assertCode(SymbolErrorCode.NOT_FOUND, () -> resolver.resolve("Missing*"));
    }

    @Test
    @DisplayName("Malformed names are INVALID_ARGUMENT")
    void resolve_malformedNames() {
        TypeNameResolver resolver = new TypeNameResolver(store, true, true);

        assertCode(SymbolErrorCode.INVALID_ARGUMENT, () -> resolver.resolve(""));
        assertCode(SymbolErrorCode.INVALID_ARGUMENT, () -> resolver.resolve("*"));
        assertCode(SymbolErrorCode.INVALID_ARGUMENT, () -> resolver.resolve("int[x]"));
        assertCode(SymbolErrorCode.INVALID_ARGUMENT, () -> resolver.resolve("int]"));
        assertCode(SymbolErrorCode.INVALID_ARGUMENT, () -> resolver.resolve("[4]"));
    }

    @Test
    @DisplayName("Disabled demand creation is UNSUPPORTED")
    void resolve_demandCreationDisabled() {
        TypeNameResolver resolver = new TypeNameResolver(store, false, false);

        assertCode(SymbolErrorCode.UNSUPPORTED, () -> resolver.resolve("int*"));
        assertCode(SymbolErrorCode.UNSUPPORTED, () -> resolver.resolve("int[2]"));
    }

    private static void assertCode(SymbolErrorCode expected, Runnable call) {
        SymbolException e = assertThrows(SymbolException.class, call::run);
        assertEquals(expected, e.getCode());
    }
}
