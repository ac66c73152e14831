package org.symforge.arch;

/**
 * Target machine families known to the symbol builder.
 */
public enum ArchitectureKind {
    X86,
    AMD64,
    ARM64
}
