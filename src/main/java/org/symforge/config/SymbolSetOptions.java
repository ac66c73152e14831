package org.symforge.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.util.List;

/**
 * Options of a symbol set, bound from the {@code symforge} configuration block.
 *
 * @param addBasicCTypes Whether new symbol sets start with the basic C types.
 * @param demandCreatePointerTypes Whether unknown {@code T*}-style type names create pointer types.
 * @param demandCreateArrayTypes Whether unknown {@code T[N]}-style type names create array types.
 * @param aliasMnemonics Mnemonics the range builder treats as copies from input to output.
 */
public record SymbolSetOptions(boolean addBasicCTypes, boolean demandCreatePointerTypes, boolean demandCreateArrayTypes,
                               List<String> aliasMnemonics) {

    private static final String ROOT = "symforge";

    public SymbolSetOptions {
        aliasMnemonics = List.copyOf(aliasMnemonics);
    }

    /**
     * @param config A configuration that contains the {@code symforge} block.
     */
    public static SymbolSetOptions fromConfig(Config config) {
        Config root = config.getConfig(ROOT);
        Config symbolSet = root.getConfig("symbol-set");
        return new SymbolSetOptions(
                symbolSet.getBoolean("add-basic-c-types"),
                symbolSet.getBoolean("demand-create-pointer-types"),
                symbolSet.getBoolean("demand-create-array-types"),
                root.getStringList("range-builder.alias-mnemonics"));
    }

    /**
     * @return The options of {@code reference.conf}.
     */
    public static SymbolSetOptions defaults() {
        return fromConfig(ConfigFactory.defaultReference());
    }

    public SymbolSetOptions withBasicCTypes(boolean enabled) {
        return new SymbolSetOptions(enabled, demandCreatePointerTypes, demandCreateArrayTypes, aliasMnemonics);
    }

    public SymbolSetOptions withDemandCreation(boolean pointers, boolean arrays) {
        return new SymbolSetOptions(addBasicCTypes, pointers, arrays, aliasMnemonics);
    }
}
