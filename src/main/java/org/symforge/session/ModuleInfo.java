package org.symforge.session;

import java.util.Objects;

/**
 * A loaded module as described by the host.
 *
 * @param key A key unique within the process, e.g. the image path.
 * @param name The module name.
 * @param baseAddress The load address.
 * @param size The image size in bytes.
 */
public record ModuleInfo(String key, String name, long baseAddress, long size) {

    public ModuleInfo {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(name, "name");
        if (size < 0) {
            throw new IllegalArgumentException("Module size must not be negative: " + size);
        }
    }

    public boolean contains(long address) {
        return address >= baseAddress && address - baseAddress < size;
    }
}
