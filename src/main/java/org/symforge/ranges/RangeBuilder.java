package org.symforge.ranges;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.symforge.arch.Location;
import org.symforge.arch.RegisterCatalog;
import org.symforge.convention.CallingConvention;
import org.symforge.disasm.BasicBlock;
import org.symforge.disasm.FlowEdge;
import org.symforge.disasm.IDisassembler;
import org.symforge.disasm.Instruction;
import org.symforge.disasm.Operand;
import org.symforge.disasm.OperandFlag;
import org.symforge.disasm.OperandRegister;
import org.symforge.model.SymbolException;
import org.symforge.model.SymbolStore;
import org.symforge.model.functions.AddressRange;
import org.symforge.model.functions.FunctionSymbol;
import org.symforge.model.functions.LiveRange;
import org.symforge.model.functions.VariableSymbol;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Computes the live ranges of a function's parameters by a forward dataflow walk over the function's
 * basic blocks, seeded with the entry locations from a calling convention.
 * <p>
 * Blocks are visited from a worklist of (block, predecessor) pairs. Entering a block merges the
 * predecessor's exit locations into the block's entry state; a block is walked on its first visit and
 * again only when a merge brought in a location it had not seen. While walking, every live range grows
 * by each instruction unless the instruction kills it:
 * <ul>
 *     <li>any write to the register holding a parameter kills that range, even a pass-through copy;</li>
 *     <li>a call kills ranges based on volatile registers.</li>
 * </ul>
 * A move-like instruction whose single input holds a parameter opens an additional range at its output.
 * Once the worklist is empty the per-block ranges are merged and written back to the parameters,
 * replacing their previous live ranges.
 */
public class RangeBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(RangeBuilder.class);

    private final IDisassembler disassembler;
    private final Set<String> aliasMnemonics;

    /**
     * @param disassembler The host disassembler.
     * @param aliasMnemonics Mnemonics of instructions that copy their input to their output.
     */
    public RangeBuilder(IDisassembler disassembler, Collection<String> aliasMnemonics) {
        this.disassembler = disassembler;
        this.aliasMnemonics = aliasMnemonics.stream()
                .map(m -> m.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * Rebuilds the live ranges of all parameters of a function.
     *
     * @param store The store holding the function.
     * @param function The function to analyze.
     * @param convention The calling convention supplying entry locations and volatility.
     * @param moduleBase The load address of the module, used to translate to disassembler addresses.
     * @return What was written and how much work it took.
     * @throws SymbolException {@code UNEXPECTED} if the disassembler returns no block at the entry point.
     */
    public RangeBuildReport build(SymbolStore store, FunctionSymbol function, CallingConvention convention, long moduleBase) {
        List<VariableSymbol> parameters = function.parameters();
        if (parameters.isEmpty()) {
            LOG.debug("Function '{}' has no parameters, nothing to build", function.name());
            return RangeBuildReport.empty(function.id());
        }
        return new Analysis(store, function, parameters, convention, moduleBase).run();
    }

    private record Visit(BlockState block, BlockState from) {
    }

    private static final class OpenRange {
        private final int parameterIndex;
        private final Location location;
        private final long start;
        private long end;

        OpenRange(int parameterIndex, Location location, long start) {
            this.parameterIndex = parameterIndex;
            this.location = location;
            this.start = start;
            this.end = start;
        }

        ObservedRange close(long closeAt, int traversal) {
            return new ObservedRange(parameterIndex, start, closeAt, location, traversal);
        }
    }

    private final class Analysis {
        private final SymbolStore store;
        private final FunctionSymbol function;
        private final List<VariableSymbol> parameters;
        private final CallingConvention convention;
        private final RegisterCatalog registers;
        private final long functionStart;
        private final Map<Long, BlockState> blocks = new TreeMap<>();
        private final Deque<Visit> worklist = new ArrayDeque<>();
        private int walks;

        Analysis(SymbolStore store, FunctionSymbol function, List<VariableSymbol> parameters,
                 CallingConvention convention, long moduleBase) {
            this.store = store;
            this.function = function;
            this.parameters = parameters;
            this.convention = convention;
            this.registers = convention.registers();
            this.functionStart = moduleBase + function.offset();
        }

        RangeBuildReport run() {
            for (BasicBlock block : disassembler.disassembleFunction(functionStart)) {
                blocks.put(block.startAddress(), new BlockState(block, parameters.size()));
            }
            BlockState entry = blocks.get(functionStart);
            if (entry == null) {
                throw SymbolException.unexpected("Disassembler returned no block at entry %#x of '%s'",
                        functionStart, function.name());
            }

            List<Location> placements = convention.placeParameters(store, function);
            for (int p = 0; p < parameters.size(); p++) {
                Location placement = placements.get(p);
                if (!placement.isNone()) {
                    entry.offer(p, placement, registers);
                }
            }

            worklist.add(new Visit(entry, null));
            while (!worklist.isEmpty()) {
                traverse(worklist.poll());
            }

            RangeBuildReport report = writeBack();
            LOG.debug("Built ranges for {} parameters of '{}': {} blocks, {} walks, {} deferred splits",
                    parameters.size(), function.name(), report.blocks(), report.walks(), report.deferredSplits());
            return report;
        }

        private void traverse(Visit visit) {
            BlockState state = visit.block();
            boolean changed = visit.from() != null && carryOver(visit.from(), state);
            if (state.traversalCount() != 0 && !changed) {
                return;
            }

            walk(state);

            for (FlowEdge edge : state.block().outboundFlows()) {
                BlockState destination = blocks.get(edge.destinationBlockAddress());
                if (destination == null) {
                    LOG.debug("Flow from {} to {} leaves '{}'", Long.toHexString(edge.sourceInstructionAddress()),
                            Long.toHexString(edge.destinationBlockAddress()), function.name());
                    continue;
                }
                worklist.add(new Visit(destination, state));
            }
        }

        private boolean carryOver(BlockState from, BlockState to) {
            boolean changed = false;
            for (int p = 0; p < parameters.size(); p++) {
                for (Location location : from.exit(p)) {
                    changed |= to.offer(p, location, registers);
                }
            }
            return changed;
        }

        private void walk(BlockState state) {
            int traversal = state.beginWalk();
            walks++;
            BasicBlock block = state.block();
            LOG.debug("Walking block {} of '{}' (traversal {})", Long.toHexString(block.startAddress()),
                    function.name(), traversal);

            List<OpenRange> open = new ArrayList<>();
            for (int p = 0; p < parameters.size(); p++) {
                for (Location pending : state.entry(p)) {
                    open.add(new OpenRange(p, pending, block.startAddress()));
                }
            }

            for (Instruction instruction : block.instructions()) {
                List<OpenRange> aliases = aliasesOf(instruction, open);

                Iterator<OpenRange> it = open.iterator();
                while (it.hasNext()) {
                    OpenRange range = it.next();
                    if (kills(instruction, range.location)) {
                        state.record(range.close(instruction.address(), traversal));
                        it.remove();
                    } else {
                        range.end = instruction.end();
                    }
                }

                for (OpenRange alias : aliases) {
                    boolean present = open.stream().anyMatch(r -> r.parameterIndex == alias.parameterIndex
                            && r.location.isEquivalentTo(alias.location, registers));
                    if (!present) {
                        open.add(alias);
                    }
                }
            }

            for (OpenRange range : open) {
                state.record(range.close(range.end, traversal));
                state.liveAtExit(range.parameterIndex, range.location);
            }
        }

        private boolean kills(Instruction instruction, Location location) {
            if (instruction.call() && location.isRegisterBased() && !convention.isNonVolatile(location.registerId())) {
                return true;
            }
            if (!location.isRegisterBased()) {
                return false;
            }
            // a write to the base register ends a register-relative location too
            int owner = registers.wholeRegisterOf(location.registerId());
            for (Operand operand : instruction.operands()) {
                if (!operand.isOutput() || !operand.has(OperandFlag.REGISTER)) {
                    continue;
                }
                for (OperandRegister register : operand.registers()) {
                    if (registers.wholeRegisterOf(register.registerId()) == owner) {
                        return true;
                    }
                }
            }
            return false;
        }

        private List<OpenRange> aliasesOf(Instruction instruction, List<OpenRange> open) {
            if (!aliasMnemonics.contains(instruction.mnemonic())) {
                return List.of();
            }
            List<Operand> inputs = instruction.operands().stream().filter(Operand::isInput).collect(Collectors.toList());
            List<Operand> outputs = instruction.operands().stream().filter(Operand::isOutput).collect(Collectors.toList());
            if (inputs.size() != 1 || outputs.size() != 1) {
                return List.of();
            }
            Optional<Location> source = locationOf(inputs.get(0));
            Optional<Location> target = locationOf(outputs.get(0));
            if (source.isEmpty() || target.isEmpty()) {
                return List.of();
            }

            List<OpenRange> aliases = new ArrayList<>();
            for (OpenRange range : open) {
                if (range.location.isEquivalentTo(source.get(), registers)) {
                    aliases.add(new OpenRange(range.parameterIndex, target.get(), instruction.end()));
                }
            }
            return aliases;
        }

        private Optional<Location> locationOf(Operand operand) {
            if (operand.registers().size() != 1) {
                return Optional.empty();
            }
            OperandRegister register = operand.registers().get(0);
            if (operand.has(OperandFlag.REGISTER)) {
                return Optional.of(Location.register(register.registerId()));
            }
            if (operand.has(OperandFlag.MEMORY) && !register.isScaled()) {
                return Optional.of(Location.registerRelative(register.registerId(), operand.immediate()));
            }
            return Optional.empty();
        }

        private RangeBuildReport writeBack() {
            RangeMerger merger = new RangeMerger(registers);
            List<AddressRange> functionRanges = function.relativeRanges();
            Map<Long, List<LiveRange>> written = new LinkedHashMap<>();

            for (int p = 0; p < parameters.size(); p++) {
                final int index = p;
                List<ObservedRange> observed = blocks.values().stream()
                        .flatMap(b -> b.observed().stream())
                        .filter(r -> r.parameterIndex() == index)
                        .collect(Collectors.toList());

                VariableSymbol parameter = parameters.get(p);
                parameter.deleteAllLiveRanges();
                for (ObservedRange range : merger.merge(observed)) {
                    long start = range.start() - functionStart;
                    long end = range.end() - functionStart;
                    for (AddressRange functionRange : functionRanges) {
                        long from = Math.max(start, functionRange.offset());
                        long to = Math.min(end, functionRange.end());
                        if (to > from) {
                            parameter.addLiveRange(from, to - from, range.location());
                        }
                    }
                }
                written.put(parameter.id(), parameter.liveRanges());
            }
            return new RangeBuildReport(function.id(), written, blocks.size(), walks, merger.deferredSplits());
        }
    }
}
