package org.symforge.arch;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Tag("unit")
class RegisterCatalogTest {

    private final RegisterCatalog registers = Amd64RegisterCatalog.create();

    @Test
    @DisplayName("Names resolve case-insensitively to canonical ids")
    void findByName_isCaseInsensitive() {
        assertEquals(330, registers.findByName("RCX").orElseThrow().id());
        assertEquals(18, registers.findByName("ecx").orElseThrow().id());
        assertEquals(360, registers.findByName(" r8d ").orElseThrow().id());
        assertFalse(registers.findByName("eflags").isPresent());
    }

    @Test
    @DisplayName("Sub-registers map to their whole register")
    void wholeRegisterOf_walksParents() {
        assertEquals(330, registers.wholeRegisterOf(2));
        assertEquals(330, registers.wholeRegisterOf(6));
        assertEquals(336, registers.wholeRegisterOf(344));
        assertEquals(155, registers.wholeRegisterOf(155));
        assertEquals(9999, registers.wholeRegisterOf(9999));
    }

    @Test
    @DisplayName("The view for a value is the largest low sub-register that fits it")
    void viewForValue_picksLowSubRegister() {
        assertEquals(330, registers.viewForValue(330, 8));
        assertEquals(18, registers.viewForValue(330, 4));
        assertEquals(10, registers.viewForValue(330, 2));
        assertEquals(2, registers.viewForValue(330, 1));
        assertEquals(10, registers.viewForValue(330, 3));
        assertEquals(155, registers.viewForValue(155, 8));
    }

    @Test
    @DisplayName("High byte registers sit above bit zero of their parent")
    void subRegisterMetadata() {
        RegisterInfo ch = registers.findByName("ch").orElseThrow();

        assertEquals(8, ch.subLsb());
        assertEquals(15, ch.subMsb());
        assertFalse(ch.isWholeRegister());
        assertTrue(registers.findByName("rip").orElseThrow().isWholeRegister());
        assertEquals("rsp", registers.nameOf(335));
    }

    @Test
    @DisplayName("Equivalent locations compare by whole register")
    void location_equivalence() {
        assertTrue(Location.register(18).isEquivalentTo(Location.register(330), registers));
        assertFalse(Location.register(18).isEquivalentTo(Location.register(331), registers));
        assertFalse(Location.register(330).isEquivalentTo(Location.registerRelative(330, 0), registers));
        assertTrue(Location.registerRelative(21, 8).isEquivalentTo(Location.registerRelative(335, 8), registers));
        assertTrue(Location.virtual(0x10).isEquivalentTo(Location.virtual(0x10), registers));
    }
}
