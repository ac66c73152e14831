package org.symforge.session;

/**
 * The register state of a stopped thread that a scope lookup needs.
 *
 * @param instructionPointer The absolute instruction pointer.
 * @param stackPointer The absolute stack pointer.
 */
public record RegisterContext(long instructionPointer, long stackPointer) {
}
