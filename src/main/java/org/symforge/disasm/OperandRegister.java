package org.symforge.disasm;

/**
 * A register referenced by an operand.
 *
 * @param registerId The canonical register id.
 * @param scale The scale factor for an index register of a memory operand, 0 when not scaled.
 */
public record OperandRegister(int registerId, int scale) {

    public static OperandRegister of(int registerId) {
        return new OperandRegister(registerId, 0);
    }

    public boolean isScaled() {
        return scale > 1;
    }
}
