package org.symforge.importer;

import org.symforge.api.ISymbolSet;

/**
 * A secondary symbol source that copies symbols into a symbol set on demand, before a lookup runs.
 * Every import method returns whether it added anything.
 */
public interface ISymbolImporter {

    /**
     * Opens the secondary source.
     *
     * @throws SymbolImportException if the source cannot be opened.
     */
    void connect() throws SymbolImportException;

    void disconnect();

    boolean importForOffsetQuery(ISymbolSet target, long moduleOffset) throws SymbolImportException;

    boolean importForNameQuery(ISymbolSet target, String name) throws SymbolImportException;

    boolean importForRegexQuery(ISymbolSet target, String pattern) throws SymbolImportException;
}
