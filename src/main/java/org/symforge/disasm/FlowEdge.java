package org.symforge.disasm;

/**
 * An outbound control flow of a basic block.
 *
 * @param sourceInstructionAddress The address of the instruction the flow leaves from.
 * @param destinationBlockAddress The start address of the block the flow enters.
 */
public record FlowEdge(long sourceInstructionAddress, long destinationBlockAddress) {
}
