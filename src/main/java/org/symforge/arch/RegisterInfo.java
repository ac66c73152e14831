package org.symforge.arch;

import java.util.List;

/**
 * Canonical metadata for one architectural register.
 *
 * @param name The lower-case register name, e.g. {@code "ecx"}.
 * @param id The canonical register id.
 * @param size The register size in bytes.
 * @param parentId The id of the enclosing register, or 0 if this is a whole register.
 * @param subLsb The least significant bit of this register within its parent.
 * @param subMsb The most significant bit of this register within its parent.
 * @param subRegisters The ids of the registers directly contained in this one, in enumeration order.
 */
public record RegisterInfo(String name, int id, int size, int parentId, int subLsb, int subMsb, List<Integer> subRegisters) {

    public RegisterInfo {
        subRegisters = List.copyOf(subRegisters);
    }

    public boolean isWholeRegister() {
        return parentId == 0;
    }
}
