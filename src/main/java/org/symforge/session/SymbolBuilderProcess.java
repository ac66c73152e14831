package org.symforge.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.symforge.SymbolSet;
import org.symforge.api.ISymbolSet;
import org.symforge.api.SymbolBuilderException;
import org.symforge.api.SymbolErrorCode;
import org.symforge.arch.MachineArchitecture;
import org.symforge.config.SymbolSetOptions;
import org.symforge.disasm.IDisassembler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The symbol sets of one debugged process, keyed by module.
 */
public final class SymbolBuilderProcess {

    private static final Logger LOGGER = LoggerFactory.getLogger(SymbolBuilderProcess.class);

    private final long processId;
    private final MachineArchitecture architecture;
    private final SymbolSetOptions options;
    private final IDisassembler disassembler;
    private final ISymbolEventSink eventSink;
    private final Map<String, ISymbolSet> symbolSets = new LinkedHashMap<>();

    SymbolBuilderProcess(final long processId, final MachineArchitecture architecture, final SymbolSetOptions options,
                         final IDisassembler disassembler, final ISymbolEventSink eventSink) {
        this.processId = processId;
        this.architecture = architecture;
        this.options = options;
        this.disassembler = disassembler;
        this.eventSink = eventSink;
    }

    public long processId() {
        return processId;
    }

    /**
     * Creates an empty symbol set for a loaded module.
     *
     * @throws SymbolBuilderException {@code INVALID_ARGUMENT} if the module key already has a symbol set.
     */
    public ISymbolSet createSymbolSet(final ModuleInfo module) throws SymbolBuilderException {
        if (symbolSets.containsKey(module.key())) {
            throw new SymbolBuilderException(SymbolErrorCode.INVALID_ARGUMENT,
                "Process " + processId + " already has symbols for module '" + module.key() + "'");
        }
        final ISymbolSet symbolSet = new SymbolSet(module, architecture, options, disassembler, eventSink);
        symbolSets.put(module.key(), symbolSet);
        LOGGER.debug("Process {} now has {} symbol set(s).", processId, symbolSets.size());
        return symbolSet;
    }

    public Optional<ISymbolSet> findSymbolSet(final String moduleKey) {
        return Optional.ofNullable(symbolSets.get(moduleKey));
    }

    /**
     * @throws SymbolBuilderException {@code NOT_FOUND} if the module has no symbol set.
     */
    public ISymbolSet requireSymbolSet(final String moduleKey) throws SymbolBuilderException {
        final ISymbolSet symbolSet = symbolSets.get(moduleKey);
        if (symbolSet == null) {
            throw new SymbolBuilderException(SymbolErrorCode.NOT_FOUND,
                "Process " + processId + " has no symbols for module '" + moduleKey + "'");
        }
        return symbolSet;
    }

    /**
     * @return The symbol set of the module whose image contains the absolute address.
     */
    public Optional<ISymbolSet> findSymbolSetForAddress(final long address) {
        return symbolSets.values().stream()
            .filter(s -> s.module().contains(address))
            .findFirst();
    }

    /**
     * Drops the symbol set of an unloaded module and disconnects its importer.
     *
     * @return Whether the module had a symbol set.
     */
    public boolean removeSymbolSet(final String moduleKey) {
        final ISymbolSet removed = symbolSets.remove(moduleKey);
        if (removed == null) {
            return false;
        }
        removed.disconnectImporter();
        LOGGER.info("Removed symbols of module '{}' from process {}.", moduleKey, processId);
        return true;
    }

    public List<ISymbolSet> symbolSets() {
        return Collections.unmodifiableList(new ArrayList<>(symbolSets.values()));
    }

    void close() {
        // Last created, first closed
        final List<String> keys = new ArrayList<>(symbolSets.keySet());
        Collections.reverse(keys);
        for (final String key : keys) {
            removeSymbolSet(key);
        }
    }
}
