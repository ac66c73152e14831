package org.symforge.disasm;

import java.util.List;

/**
 * A straight-line run of instructions with a single entry.
 *
 * @param startAddress The address of the first instruction.
 * @param endAddress The address just past the last instruction.
 * @param instructions The instructions in address order.
 * @param outboundFlows Fall-through and branch flows leaving the block.
 */
public record BasicBlock(long startAddress, long endAddress, List<Instruction> instructions, List<FlowEdge> outboundFlows) {

    public BasicBlock {
        if (endAddress < startAddress) {
            throw new IllegalArgumentException("Block end precedes its start: " + Long.toHexString(startAddress));
        }
        instructions = List.copyOf(instructions);
        outboundFlows = List.copyOf(outboundFlows);
    }
}
