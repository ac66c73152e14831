package org.symforge.api;

/**
 * An exception that is thrown when a symbol builder operation fails.
 * <p>
 * It is part of the public API and hides the internal exception types of the symbol model.
 * Every instance carries a {@link SymbolErrorCode}.
 */
public class SymbolBuilderException extends Exception {

    private final SymbolErrorCode code;

    /**
     * Constructs a new exception with the specified error code and detail message.
     * @param code The failure kind.
     * @param message The detail message.
     */
    public SymbolBuilderException(SymbolErrorCode code, String message) {
        super(message, null);
        this.code = code;
    }

    /**
     * Constructs a new exception with the specified error code, detail message and cause.
     * @param code The failure kind.
     * @param message The detail message.
     * @param cause The cause.
     */
    public SymbolBuilderException(SymbolErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    /**
     * @return The failure kind of this exception.
     */
    public SymbolErrorCode getCode() {
        return code;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + code + "]: " + getMessage();
    }
}
