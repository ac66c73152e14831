package org.symforge.arch;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * AMD64 general purpose, instruction pointer and XMM registers with their sub-register views, using the
 * CodeView register numbering as canonical ids. Hosts that carry their own register metadata pass their
 * own {@link RegisterCatalog} instead.
 */
public final class Amd64RegisterCatalog {

    private static final String[] LEGACY = {"ax", "cx", "dx", "bx"};
    private static final int[] LEGACY_WHOLE = {328, 330, 331, 329};
    private static final int[] LEGACY_LOW = {1, 2, 3, 4};
    private static final int[] LEGACY_HIGH = {5, 6, 7, 8};
    private static final int[] LEGACY_WORD = {9, 10, 11, 12};
    private static final int[] LEGACY_DWORD = {17, 18, 19, 20};

    private static final String[] INDEX = {"sp", "bp", "si", "di"};
    private static final int[] INDEX_WHOLE = {335, 334, 332, 333};
    private static final int[] INDEX_LOW = {327, 326, 324, 325};
    private static final int[] INDEX_WORD = {13, 14, 15, 16};
    private static final int[] INDEX_DWORD = {21, 22, 23, 24};

    private Amd64RegisterCatalog() {
        // Private constructor to prevent instantiation
    }

    /**
     * @return A fresh catalog of the AMD64 registers.
     */
    public static RegisterCatalog create() {
        Builder builder = new Builder();

        for (int i = 0; i < LEGACY.length; i++) {
            String base = LEGACY[i].substring(0, 1);
            builder.whole("r" + LEGACY[i], LEGACY_WHOLE[i], 8);
            builder.sub("e" + LEGACY[i], LEGACY_DWORD[i], 4, LEGACY_WHOLE[i], 0);
            builder.sub(LEGACY[i], LEGACY_WORD[i], 2, LEGACY_DWORD[i], 0);
            builder.sub(base + "l", LEGACY_LOW[i], 1, LEGACY_WORD[i], 0);
            builder.sub(base + "h", LEGACY_HIGH[i], 1, LEGACY_WORD[i], 8);
        }

        for (int i = 0; i < INDEX.length; i++) {
            builder.whole("r" + INDEX[i], INDEX_WHOLE[i], 8);
            builder.sub("e" + INDEX[i], INDEX_DWORD[i], 4, INDEX_WHOLE[i], 0);
            builder.sub(INDEX[i], INDEX_WORD[i], 2, INDEX_DWORD[i], 0);
            builder.sub(INDEX[i] + "l", INDEX_LOW[i], 1, INDEX_WORD[i], 0);
        }

        for (int n = 8; n <= 15; n++) {
            int whole = 336 + (n - 8);
            int dword = 360 + (n - 8);
            int word = 352 + (n - 8);
            builder.whole("r" + n, whole, 8);
            builder.sub("r" + n + "d", dword, 4, whole, 0);
            builder.sub("r" + n + "w", word, 2, dword, 0);
            builder.sub("r" + n + "b", 344 + (n - 8), 1, word, 0);
        }

        builder.whole("rip", 33, 8);

        for (int n = 0; n <= 15; n++) {
            builder.whole("xmm" + n, n < 8 ? 154 + n : 252 + (n - 8), 16);
        }

        return builder.build();
    }

    private static final class Builder {
        private final Map<Integer, String> names = new LinkedHashMap<>();
        private final Map<Integer, int[]> shapes = new LinkedHashMap<>();

        void whole(String name, int id, int size) {
            names.put(id, name);
            shapes.put(id, new int[]{size, 0, 0});
        }

        void sub(String name, int id, int size, int parentId, int lsb) {
            names.put(id, name);
            shapes.put(id, new int[]{size, parentId, lsb});
        }

        RegisterCatalog build() {
            List<RegisterInfo> infos = new ArrayList<>();
            for (Map.Entry<Integer, String> entry : names.entrySet()) {
                int id = entry.getKey();
                int[] shape = shapes.get(id);
                List<Integer> subs = new ArrayList<>();
                for (Map.Entry<Integer, int[]> candidate : shapes.entrySet()) {
                    if (candidate.getValue()[1] == id) {
                        subs.add(candidate.getKey());
                    }
                }
                int lsb = shape[2];
                infos.add(new RegisterInfo(entry.getValue(), id, shape[0], shape[1], lsb, lsb + shape[0] * 8 - 1, subs));
            }
            return new RegisterCatalog(infos);
        }
    }
}
