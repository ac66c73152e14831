package org.symforge.model.types;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.symforge.api.SymbolErrorCode;
import org.symforge.model.SymbolException;
import org.symforge.model.SymbolKind;
import org.symforge.model.SymbolStore;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Layout of user defined types: automatic placement, explicit offsets, base classes and propagation of
 * size changes into containing types.
 */
@Tag("unit")
class UdtLayoutTest {

    private SymbolStore store;
    private long charId;
    private long intId;
    private long doubleId;

    @BeforeEach
    void setUp() {
        store = new SymbolStore(8);
        BasicCTypes.addTo(store);
        charId = store.findByName("char").getAsLong();
        intId = store.findByName("int").getAsLong();
        doubleId = store.findByName("double").getAsLong();
    }

    @Test
    @DisplayName("Automatic members are padded to their alignment and the size to the type alignment")
    void layout_padsAutomaticMembers() {
        long udtId = store.add(new UdtTypeSymbol("S", null));
        long c = store.add(new FieldSymbol(udtId, "c", charId, null));
        long i = store.add(new FieldSymbol(udtId, "i", intId, null));
        long d = store.add(new FieldSymbol(udtId, "d", charId, null));

        UdtTypeSymbol udt = store.require(udtId, UdtTypeSymbol.class);
        assertEquals(0, offsetOf(c));
        assertEquals(4, offsetOf(i));
        assertEquals(8, offsetOf(d));
        assertEquals(12, udt.size());
        assertEquals(4, udt.alignment());
    }

    @Test
    @DisplayName("Every automatic member offset is a multiple of its type's alignment")
    void layout_respectsAlignment() {
        long udtId = store.add(new UdtTypeSymbol("Mixed", null));
        long[] typeIds = {charId, doubleId, charId, intId, charId, doubleId};
        long[] members = new long[typeIds.length];
        for (int k = 0; k < typeIds.length; k++) {
            members[k] = store.add(new FieldSymbol(udtId, "m" + k, typeIds[k], null));
        }

        for (int k = 0; k < members.length; k++) {
            long alignment = store.require(typeIds[k], TypeSymbol.class).alignment();
            assertEquals(0, offsetOf(members[k]) % alignment, "member m" + k);
        }
        UdtTypeSymbol udt = store.require(udtId, UdtTypeSymbol.class);
        assertEquals(8, udt.alignment());
        assertEquals(0, udt.size() % udt.alignment());
    }

    @Test
    @DisplayName("Laying out twice gives the same result")
    void layout_isIdempotent() {
        long udtId = store.add(new UdtTypeSymbol("S", null));
        long c = store.add(new FieldSymbol(udtId, "c", charId, null));
        long x = store.add(new FieldSymbol(udtId, "x", doubleId, null));
        UdtTypeSymbol udt = store.require(udtId, UdtTypeSymbol.class);

        udt.layout();
        long size = udt.size();
        long offset = offsetOf(x);
        udt.layout();

        assertEquals(size, udt.size());
        assertEquals(offset, offsetOf(x));
        assertEquals(0, offsetOf(c));
    }

    @Test
    @DisplayName("Explicit offsets are honored and automatic members continue after them")
    void layout_explicitOffsets() {
        long udtId = store.add(new UdtTypeSymbol("S", null));
        long fixed = store.add(new FieldSymbol(udtId, "fixed", intId, 16L));
        long next = store.add(new FieldSymbol(udtId, "next", charId, null));

        assertEquals(16, offsetOf(fixed));
        assertEquals(20, offsetOf(next));
        assertEquals(24, store.require(udtId, UdtTypeSymbol.class).size());
    }

    @Test
    @DisplayName("Switching a member between explicit and automatic layout relays the owner")
    void layout_toggleAutomatic() {
        long udtId = store.add(new UdtTypeSymbol("S", null));
        long a = store.add(new FieldSymbol(udtId, "a", intId, null));
        PositionalMemberSymbol member = store.require(a, PositionalMemberSymbol.class);

        member.setOffset(8);
        assertEquals(12, store.require(udtId, UdtTypeSymbol.class).size());
        assertFalse(member.isAutomaticLayout());

        member.setAutomaticLayout();
        assertEquals(0, member.offset());
        assertEquals(4, store.require(udtId, UdtTypeSymbol.class).size());
    }

    @Test
    @DisplayName("Base classes are placed before fields regardless of declaration order")
    void layout_baseClassesFirst() {
        long baseId = store.add(new UdtTypeSymbol("Base", null));
        store.add(new FieldSymbol(baseId, "value", doubleId, null));

        long derivedId = store.add(new UdtTypeSymbol("Derived", null));
        long field = store.add(new FieldSymbol(derivedId, "flag", charId, null));
        long base = store.add(new BaseClassSymbol(derivedId, "Base", baseId, null));

        assertEquals(SymbolKind.BASE_CLASS, store.require(base).kind());
        assertEquals(0, offsetOf(base));
        assertEquals(8, offsetOf(field));
        assertEquals(16, store.require(derivedId, UdtTypeSymbol.class).size());
    }

    @Test
    @DisplayName("Growing a nested type relays every type that contains it")
    void layout_propagatesToContainers() {
        long innerId = store.add(new UdtTypeSymbol("Inner", null));
        store.add(new FieldSymbol(innerId, "a", intId, null));

        long outerId = store.add(new UdtTypeSymbol("Outer", null));
        store.add(new FieldSymbol(outerId, "tag", charId, null));
        long inner = store.add(new FieldSymbol(outerId, "inner", innerId, null));
        long tail = store.add(new FieldSymbol(outerId, "tail", charId, null));

        long arrayId = store.add(new ArrayTypeSymbol("Inner[3]", innerId, 3));

        assertEquals(12, store.require(outerId, UdtTypeSymbol.class).size());
        assertEquals(12, store.require(arrayId, TypeSymbol.class).size());

        store.add(new FieldSymbol(innerId, "b", doubleId, null));

        assertEquals(16, store.require(innerId, UdtTypeSymbol.class).size());
        assertEquals(8, offsetOf(inner));
        assertEquals(24, offsetOf(tail));
        assertEquals(32, store.require(outerId, UdtTypeSymbol.class).size());
        assertEquals(48, store.require(arrayId, TypeSymbol.class).size());
        assertEquals(8, store.require(arrayId, TypeSymbol.class).alignment());
    }

    @Test
    @DisplayName("A member whose owner cannot be relaid is not added")
    void add_rollsBackWhenOwnerLayoutFails() {
        long innerId = store.add(new UdtTypeSymbol("Inner", null));
        long outerId = store.add(new UdtTypeSymbol("Outer", null));
        long a = store.add(new FieldSymbol(outerId, "a", innerId, null));
        store.delete(innerId);
        int sizeBefore = store.size();

        FieldSymbol b = new FieldSymbol(outerId, "b", intId, null);
        SymbolException e = assertThrows(SymbolException.class, () -> store.add(b));

        assertEquals(SymbolErrorCode.UNEXPECTED, e.getCode());
        assertFalse(b.isAttached());
        assertEquals(sizeBefore, store.size());
        assertArrayEquals(new long[] {a}, store.require(outerId).childIds().toLongArray());
        assertEquals(0, store.dependentCount(intId, a + 1));
    }

    @Test
    @DisplayName("Changing a member type relays the owner")
    void setType_relays() {
        long udtId = store.add(new UdtTypeSymbol("S", null));
        long a = store.add(new FieldSymbol(udtId, "a", charId, null));
        long b = store.add(new FieldSymbol(udtId, "b", charId, null));

        store.require(a, PositionalMemberSymbol.class).setType(doubleId);

        assertEquals(8, offsetOf(b));
        assertEquals(16, store.require(udtId, UdtTypeSymbol.class).size());
        assertEquals(1, store.dependentCount(doubleId, a));
        assertEquals(0, store.dependentCount(charId, a));
    }

    @Test
    @DisplayName("An empty type has size zero and alignment one")
    void layout_emptyType() {
        long udtId = store.add(new UdtTypeSymbol("Empty", null));
        UdtTypeSymbol udt = store.require(udtId, UdtTypeSymbol.class);

        udt.layout();

        assertEquals(0, udt.size());
        assertEquals(1, udt.alignment());
        assertTrue(udt.childIds().isEmpty());
    }

    private long offsetOf(long memberId) {
        return store.require(memberId, PositionalMemberSymbol.class).offset();
    }
}
