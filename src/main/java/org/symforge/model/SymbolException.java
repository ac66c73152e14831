package org.symforge.model;

import org.symforge.api.SymbolErrorCode;

/**
 * Unchecked failure used inside the symbol model. The public {@code SymbolSet} boundary converts it
 * into a {@link org.symforge.api.SymbolBuilderException} with the same code.
 */
public class SymbolException extends RuntimeException {

    private final SymbolErrorCode code;

    public SymbolException(SymbolErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public SymbolException(SymbolErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public SymbolErrorCode getCode() {
        return code;
    }

    public static SymbolException notFound(String format, Object... args) {
        return new SymbolException(SymbolErrorCode.NOT_FOUND, String.format(format, args));
    }

    public static SymbolException invalidArgument(String format, Object... args) {
        return new SymbolException(SymbolErrorCode.INVALID_ARGUMENT, String.format(format, args));
    }

    public static SymbolException unsupported(String format, Object... args) {
        return new SymbolException(SymbolErrorCode.UNSUPPORTED, String.format(format, args));
    }

    public static SymbolException unexpected(String format, Object... args) {
        return new SymbolException(SymbolErrorCode.UNEXPECTED, String.format(format, args));
    }
}
