package org.symforge.disasm;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * One operand of an instruction.
 *
 * @param flags The operand flags.
 * @param registers The registers the operand references, base register first.
 * @param immediate The immediate value or memory displacement.
 */
public record Operand(Set<OperandFlag> flags, List<OperandRegister> registers, long immediate) {

    public Operand {
        flags = Set.copyOf(flags);
        registers = List.copyOf(registers);
    }

    public static Operand registerIn(int registerId) {
        return new Operand(EnumSet.of(OperandFlag.INPUT, OperandFlag.REGISTER), List.of(OperandRegister.of(registerId)), 0);
    }

    public static Operand registerOut(int registerId) {
        return new Operand(EnumSet.of(OperandFlag.OUTPUT, OperandFlag.REGISTER), List.of(OperandRegister.of(registerId)), 0);
    }

    public static Operand registerInOut(int registerId) {
        return new Operand(EnumSet.of(OperandFlag.INPUT, OperandFlag.OUTPUT, OperandFlag.REGISTER),
                List.of(OperandRegister.of(registerId)), 0);
    }

    public static Operand memoryIn(int baseRegisterId, long displacement) {
        return new Operand(EnumSet.of(OperandFlag.INPUT, OperandFlag.MEMORY), List.of(OperandRegister.of(baseRegisterId)), displacement);
    }

    public static Operand memoryOut(int baseRegisterId, long displacement) {
        return new Operand(EnumSet.of(OperandFlag.OUTPUT, OperandFlag.MEMORY), List.of(OperandRegister.of(baseRegisterId)), displacement);
    }

    public static Operand immediate(long value) {
        return new Operand(EnumSet.of(OperandFlag.INPUT, OperandFlag.IMMEDIATE), List.of(), value);
    }

    public boolean has(OperandFlag flag) {
        return flags.contains(flag);
    }

    public boolean isInput() {
        return has(OperandFlag.INPUT);
    }

    public boolean isOutput() {
        return has(OperandFlag.OUTPUT);
    }
}
