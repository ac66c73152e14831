package org.symforge.disasm;

import java.util.List;
import java.util.Locale;

/**
 * A decoded instruction.
 *
 * @param address The absolute address.
 * @param length The encoded length in bytes.
 * @param mnemonic The textual mnemonic, e.g. {@code "mov"}.
 * @param call {@code true} for call instructions.
 * @param operands The operands in disassembler order.
 */
public record Instruction(long address, int length, String mnemonic, boolean call, List<Operand> operands) {

    public Instruction {
        mnemonic = mnemonic == null ? "" : mnemonic.toLowerCase(Locale.ROOT);
        operands = List.copyOf(operands);
    }

    public long end() {
        return address + length;
    }
}
