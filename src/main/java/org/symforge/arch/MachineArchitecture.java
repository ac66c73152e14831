package org.symforge.arch;

import java.util.Objects;

/**
 * What the host tells the symbol builder about the target machine.
 *
 * @param kind The machine family.
 * @param bitness The pointer width in bits.
 * @param registers Canonical register metadata.
 */
public record MachineArchitecture(ArchitectureKind kind, int bitness, RegisterCatalog registers) {

    public MachineArchitecture {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(registers, "registers");
        if (bitness <= 0 || bitness % 8 != 0) {
            throw new IllegalArgumentException("Invalid bitness: " + bitness);
        }
    }

    /**
     * @return An AMD64 description backed by {@link Amd64RegisterCatalog}.
     */
    public static MachineArchitecture amd64() {
        return new MachineArchitecture(ArchitectureKind.AMD64, 64, Amd64RegisterCatalog.create());
    }

    public int pointerSize() {
        return bitness / 8;
    }
}
