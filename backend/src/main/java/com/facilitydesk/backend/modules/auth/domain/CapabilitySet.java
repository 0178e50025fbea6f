package com.facilitydesk.backend.modules.auth.domain;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Effective capability flags plus free-form custom permissions.
 */
public record CapabilitySet(Set<Capability> granted, List<String> customPermissions) {

    public static final String ALL = "all";

    public CapabilitySet {
        granted = granted == null || granted.isEmpty()
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(granted));
        customPermissions = customPermissions == null ? List.of() : List.copyOf(customPermissions);
    }

    public static CapabilitySet none() {
        return new CapabilitySet(Set.of(), List.of());
    }

    public boolean has(Capability capability) {
        return customPermissions.contains(ALL) || granted.contains(capability);
    }

    /**
     * True when the named flag is granted, when custom permissions contain {@code "all"},
     * or when they contain {@code name} verbatim.
     */
    public boolean has(String name) {
        if (name == null) {
            return false;
        }
        if (customPermissions.contains(ALL) || customPermissions.contains(name)) {
            return true;
        }
        return Capability.fromKey(name).map(granted::contains).orElse(false);
    }

    public Map<String, Boolean> asFlags() {
        Map<String, Boolean> flags = new LinkedHashMap<>();
        for (Capability capability : Capability.values()) {
            flags.put(capability.key(), granted.contains(capability));
        }
        return flags;
    }
}
