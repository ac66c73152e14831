package org.symforge.convention;

import org.symforge.arch.ArchitectureKind;
import org.symforge.arch.MachineArchitecture;
import org.symforge.model.SymbolException;

/**
 * Picks the default calling convention of an architecture.
 */
public final class CallingConventions {

    private CallingConventions() {
        // Private constructor to prevent instantiation
    }

    /**
     * @throws SymbolException {@code UNSUPPORTED} for anything but AMD64.
     */
    public static CallingConvention defaultFor(MachineArchitecture architecture) {
        if (architecture.kind() == ArchitectureKind.AMD64) {
            return new WindowsAmd64CallingConvention(architecture.registers());
        }
        throw SymbolException.unsupported("No calling convention for architecture %s", architecture.kind());
    }
}
