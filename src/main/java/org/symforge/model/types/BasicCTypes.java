package org.symforge.model.types;

import org.symforge.model.SymbolStore;

import java.util.List;

/**
 * The default C basic types a new symbol set starts with.
 */
public final class BasicCTypes {

    private static final List<Entry> ENTRIES = List.of(
            new Entry("void", IntrinsicKind.VOID, 0),
            new Entry("bool", IntrinsicKind.BOOL, 1),
            new Entry("char", IntrinsicKind.CHAR, 1),
            new Entry("unsigned char", IntrinsicKind.UINT, 1),
            new Entry("wchar_t", IntrinsicKind.WCHAR, 2),
            new Entry("short", IntrinsicKind.INT, 2),
            new Entry("unsigned short", IntrinsicKind.UINT, 2),
            new Entry("int", IntrinsicKind.INT, 4),
            new Entry("unsigned int", IntrinsicKind.UINT, 4),
            new Entry("__int64", IntrinsicKind.INT, 8),
            new Entry("unsigned __int64", IntrinsicKind.UINT, 8),
            new Entry("long", IntrinsicKind.LONG, 4),
            new Entry("unsigned long", IntrinsicKind.ULONG, 4),
            new Entry("float", IntrinsicKind.FLOAT, 4),
            new Entry("double", IntrinsicKind.FLOAT, 8));

    private BasicCTypes() {
        // Private constructor to prevent instantiation
    }

    /**
     * Adds every default type that is not already named in the store.
     *
     * @param store The store to populate.
     * @return The number of types added.
     */
    public static int addTo(SymbolStore store) {
        int added = 0;
        for (Entry entry : ENTRIES) {
            if (store.findByName(entry.name()).isEmpty()) {
                store.add(new BasicTypeSymbol(entry.name(), entry.kind(), entry.size()));
                added++;
            }
        }
        return added;
    }

    private record Entry(String name, IntrinsicKind kind, int size) {
    }
}
