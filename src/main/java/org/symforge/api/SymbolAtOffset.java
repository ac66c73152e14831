package org.symforge.api;

/**
 * The result of an address lookup.
 *
 * @param symbol The symbol found.
 * @param displacement How far the queried offset lies past the symbol's base offset.
 */
public record SymbolAtOffset(SymbolInfo symbol, long displacement) {
}
