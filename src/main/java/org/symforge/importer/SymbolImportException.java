package org.symforge.importer;

/**
 * Thrown by an {@link ISymbolImporter} when the secondary symbol source cannot be read.
 */
public class SymbolImportException extends Exception {

    public SymbolImportException(String message) {
        super(message);
    }

    public SymbolImportException(String message, Throwable cause) {
        super(message, cause);
    }
}
