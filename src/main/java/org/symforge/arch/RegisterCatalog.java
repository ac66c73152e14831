package org.symforge.arch;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Canonical register metadata for one architecture, looked up by name or id. Sub-registers point to
 * their parent so that any sub-register id can be mapped to the whole register that owns it.
 */
public class RegisterCatalog {

    private final Map<Integer, RegisterInfo> byId = new LinkedHashMap<>();
    private final Map<String, RegisterInfo> byName = new LinkedHashMap<>();

    /**
     * @param registers The register metadata; ids and names must be unique.
     */
    public RegisterCatalog(Collection<RegisterInfo> registers) {
        for (RegisterInfo info : registers) {
            String key = info.name().toLowerCase(Locale.ROOT);
            if (byId.putIfAbsent(info.id(), info) != null) {
                throw new IllegalArgumentException("Duplicate register id: " + info.id());
            }
            if (byName.putIfAbsent(key, info) != null) {
                throw new IllegalArgumentException("Duplicate register name: " + info.name());
            }
        }
    }

    public Optional<RegisterInfo> findByName(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(byName.get(name.trim().toLowerCase(Locale.ROOT)));
    }

    public Optional<RegisterInfo> findById(int id) {
        return Optional.ofNullable(byId.get(id));
    }

    public Collection<RegisterInfo> registers() {
        return Collections.unmodifiableCollection(byId.values());
    }

    /**
     * Walks parent links up to the whole register. Unknown ids map to themselves.
     *
     * @param id A register or sub-register id.
     * @return The id of the owning whole register.
     */
    public int wholeRegisterOf(int id) {
        RegisterInfo info = byId.get(id);
        while (info != null && info.parentId() != 0) {
            RegisterInfo parent = byId.get(info.parentId());
            if (parent == null) {
                break;
            }
            info = parent;
        }
        return info == null ? id : info.id();
    }

    /**
     * Picks the view of a register that best holds a value: the register itself if the value is at least
     * as large, otherwise the largest sub-register at bit 0 that is not larger than the value. Among equally
     * sized candidates the one enumerated first wins.
     *
     * @param registerId The register to pick a view of.
     * @param valueSize The size of the value in bytes.
     * @return The id of the chosen register view.
     */
    public int viewForValue(int registerId, long valueSize) {
        RegisterInfo info = byId.get(registerId);
        if (info == null || valueSize >= info.size()) {
            return registerId;
        }

        RegisterInfo best = null;
        List<RegisterInfo> pending = new ArrayList<>();
        pending.add(info);
        while (!pending.isEmpty()) {
            RegisterInfo current = pending.remove(0);
            for (int subId : current.subRegisters()) {
                RegisterInfo sub = byId.get(subId);
                if (sub == null || sub.subLsb() != 0) {
                    continue;
                }
                if (sub.size() <= valueSize && (best == null || sub.size() > best.size())) {
                    best = sub;
                }
                pending.add(sub);
            }
        }
        return best == null ? registerId : best.id();
    }

    public String nameOf(int id) {
        RegisterInfo info = byId.get(id);
        return info == null ? "reg" + id : info.name();
    }
}
