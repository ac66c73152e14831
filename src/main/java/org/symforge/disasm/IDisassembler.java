package org.symforge.disasm;

import java.util.List;

/**
 * The host's disassembler. Decoding instructions is outside the symbol builder; it only consumes the
 * control flow graph.
 */
public interface IDisassembler {

    /**
     * Disassembles the function whose entry point is at {@code address}.
     *
     * @param address The absolute entry address.
     * @return The basic blocks of the function, in any order.
     */
    List<BasicBlock> disassembleFunction(long address);
}
