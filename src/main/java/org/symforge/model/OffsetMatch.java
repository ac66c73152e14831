package org.symforge.model;

/**
 * Result of an address lookup.
 *
 * @param symbolId The id of the symbol owning the address.
 * @param residual The distance between the queried address and the symbol's base offset.
 */
public record OffsetMatch(long symbolId, long residual) {
}
