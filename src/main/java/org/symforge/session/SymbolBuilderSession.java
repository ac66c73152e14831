package org.symforge.session;

import com.typesafe.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.symforge.api.SymbolBuilderException;
import org.symforge.api.SymbolErrorCode;
import org.symforge.arch.MachineArchitecture;
import org.symforge.config.ConfigLoader;
import org.symforge.config.LoggingConfigurator;
import org.symforge.config.SymbolSetOptions;
import org.symforge.disasm.IDisassembler;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The entry point a debugger host talks to. A session owns one {@link SymbolBuilderProcess} per debugged
 * process; all symbol sets it creates share the session's architecture, options and disassembler.
 *
 * <p>Sessions are not thread safe. A host is expected to call them from its engine thread.</p>
 */
public final class SymbolBuilderSession {

    private static final Logger LOGGER = LoggerFactory.getLogger(SymbolBuilderSession.class);

    private final MachineArchitecture architecture;
    private final SymbolSetOptions options;
    private final IDisassembler disassembler;
    private final ISymbolEventSink eventSink;
    private final Map<Long, SymbolBuilderProcess> processes = new LinkedHashMap<>();

    /**
     * @param architecture The architecture of the debug target.
     * @param options The options for every symbol set.
     * @param disassembler The host disassembler, or null if the host has none.
     * @param eventSink Receives change notifications, or null to ignore them.
     */
    public SymbolBuilderSession(final MachineArchitecture architecture, final SymbolSetOptions options,
                                final IDisassembler disassembler, final ISymbolEventSink eventSink) {
        this.architecture = Objects.requireNonNull(architecture, "architecture");
        this.options = Objects.requireNonNull(options, "options");
        this.disassembler = disassembler;
        this.eventSink = eventSink == null ? ISymbolEventSink.none() : eventSink;
        LOGGER.info("Symbol builder session started for {} (basic C types: {}, alias mnemonics: {}).",
            architecture.kind(), options.addBasicCTypes(), options.aliasMnemonics());
    }

    /**
     * Creates a session from the layered configuration and applies its logging levels.
     *
     * @see ConfigLoader#load()
     */
    public static SymbolBuilderSession create(final MachineArchitecture architecture, final IDisassembler disassembler,
                                              final ISymbolEventSink eventSink) {
        final Config config = ConfigLoader.load();
        LoggingConfigurator.configure(config);
        return new SymbolBuilderSession(architecture, SymbolSetOptions.fromConfig(config), disassembler, eventSink);
    }

    public MachineArchitecture architecture() {
        return architecture;
    }

    public SymbolSetOptions options() {
        return options;
    }

    /**
     * @throws SymbolBuilderException {@code INVALID_ARGUMENT} if the process is already open.
     */
    public SymbolBuilderProcess openProcess(final long processId) throws SymbolBuilderException {
        if (processes.containsKey(processId)) {
            throw new SymbolBuilderException(SymbolErrorCode.INVALID_ARGUMENT,
                "Process " + processId + " is already open");
        }
        final SymbolBuilderProcess process =
            new SymbolBuilderProcess(processId, architecture, options, disassembler, eventSink);
        processes.put(processId, process);
        LOGGER.info("Opened process {}.", processId);
        return process;
    }

    public Optional<SymbolBuilderProcess> findProcess(final long processId) {
        return Optional.ofNullable(processes.get(processId));
    }

    /**
     * Closes a process and drops all of its symbol sets.
     *
     * @return Whether the process was open.
     */
    public boolean closeProcess(final long processId) {
        final SymbolBuilderProcess process = processes.remove(processId);
        if (process == null) {
            return false;
        }
        process.close();
        LOGGER.info("Closed process {}.", processId);
        return true;
    }
}
