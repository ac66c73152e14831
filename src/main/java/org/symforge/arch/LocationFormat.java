package org.symforge.arch;

import org.symforge.model.SymbolException;

import java.util.Locale;

/**
 * Converts {@link Location} values to and from their display form:
 * <pre>
 * &lt;none&gt;          no location
 * @rcx            register
 * [rsp + 0x28]    register relative (also [rbp - 0x8] and [rsp])
 * 0x1000          module offset
 * </pre>
 * Numbers are hexadecimal, with an optional {@code 0x} prefix or {@code h} suffix.
 */
public final class LocationFormat {

    private static final String NONE_TEXT = "<none>";

    private final RegisterCatalog registers;

    public LocationFormat(RegisterCatalog registers) {
        this.registers = registers;
    }

    public String format(Location location) {
        switch (location.kind()) {
            case REGISTER:
                return "@" + registers.nameOf(location.registerId());
            case REGISTER_RELATIVE: {
                String base = registers.nameOf(location.registerId());
                long offset = location.offset();
                if (offset == 0) {
                    return "[" + base + "]";
                }
                return offset > 0
                        ? String.format("[%s + 0x%x]", base, offset)
                        : String.format("[%s - 0x%x]", base, -offset);
            }
            case VIRTUAL:
                return String.format("0x%x", location.offset());
            default:
                return NONE_TEXT;
        }
    }

    /**
     * @param text The display form of a location.
     * @return The parsed location.
     * @throws SymbolException {@code INVALID_ARGUMENT} if the text is malformed or names an unknown register.
     */
    public Location parse(String text) {
        if (text == null || text.isBlank()) {
            throw SymbolException.invalidArgument("Empty location");
        }
        String s = text.trim();
        if (s.equalsIgnoreCase(NONE_TEXT)) {
            return Location.none();
        }
        if (s.startsWith("@")) {
            return Location.register(registerId(s.substring(1), text));
        }
        if (s.startsWith("[")) {
            if (!s.endsWith("]")) {
                throw SymbolException.invalidArgument("Unterminated register-relative location '%s'", text);
            }
            return parseRelative(s.substring(1, s.length() - 1).trim(), text);
        }
        return Location.virtual(parseHex(s, text));
    }

    private Location parseRelative(String body, String text) {
        int plus = body.indexOf('+');
        int minus = body.indexOf('-');
        int split = plus >= 0 ? plus : minus;
        if (split < 0) {
            return Location.registerRelative(registerId(body, text), 0);
        }
        int registerId = registerId(body.substring(0, split), text);
        long displacement = parseHex(body.substring(split + 1).trim(), text);
        return Location.registerRelative(registerId, split == plus ? displacement : -displacement);
    }

    private int registerId(String name, String text) {
        return registers.findByName(name)
                .map(RegisterInfo::id)
                .orElseThrow(() -> SymbolException.invalidArgument("Unknown register '%s' in location '%s'", name.trim(), text));
    }

    private static long parseHex(String digits, String text) {
        String s = digits.trim().toLowerCase(Locale.ROOT);
        if (s.startsWith("0x")) {
            s = s.substring(2);
        } else if (s.endsWith("h")) {
            s = s.substring(0, s.length() - 1);
        }
        if (s.isEmpty()) {
            throw SymbolException.invalidArgument("Missing number in location '%s'", text);
        }
        try {
            return Long.parseUnsignedLong(s, 16);
        } catch (NumberFormatException e) {
            throw SymbolException.invalidArgument("Invalid number '%s' in location '%s'", digits.trim(), text);
        }
    }
}
