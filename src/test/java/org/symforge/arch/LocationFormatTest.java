package org.symforge.arch;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.symforge.api.SymbolErrorCode;
import org.symforge.model.SymbolException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@Tag("unit")
class LocationFormatTest {

    private final LocationFormat format = new LocationFormat(Amd64RegisterCatalog.create());

    @Test
    @DisplayName("Locations are formatted in their display form")
    void format_displayForms() {
        assertEquals("<none>", format.format(Location.none()));
        assertEquals("@ecx", format.format(Location.register(18)));
        assertEquals("[rsp + 0x28]", format.format(Location.registerRelative(335, 0x28)));
        assertEquals("[rbp - 0x8]", format.format(Location.registerRelative(334, -8)));
        assertEquals("[rcx]", format.format(Location.registerRelative(330, 0)));
        assertEquals("0x1000", format.format(Location.virtual(0x1000)));
    }

    @Test
    @DisplayName("Display forms parse back to their locations")
    void parse_displayForms() {
        assertEquals(Location.none(), format.parse("<none>"));
        assertEquals(Location.register(360), format.parse("@R8D"));
        assertEquals(Location.registerRelative(335, 0x28), format.parse("[rsp + 0x28]"));
        assertEquals(Location.registerRelative(334, -8), format.parse("[ rbp-8 ]"));
        assertEquals(Location.registerRelative(335, 0x20), format.parse("[rsp+20h]"));
        assertEquals(Location.virtual(0x1000), format.parse("1000"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "@nope", "[rsp + 0x28", "[rsp + ]", "zz", "[foo]"})
    @DisplayName("Malformed locations are INVALID_ARGUMENT")
    void parse_rejectsMalformed(String text) {
        SymbolException e = assertThrows(SymbolException.class, () -> format.parse(text));
        assertEquals(SymbolErrorCode.INVALID_ARGUMENT, e.getCode());
    }
}
