package org.symforge.disasm;

/**
 * Properties of an instruction operand as reported by the disassembler.
 */
public enum OperandFlag {
    INPUT,
    OUTPUT,
    REGISTER,
    MEMORY,
    IMMEDIATE
}
