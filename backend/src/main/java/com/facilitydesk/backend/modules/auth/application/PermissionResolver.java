package com.facilitydesk.backend.modules.auth.application;

import static com.facilitydesk.backend.modules.auth.domain.Capability.APPROVE_LEAVES;
import static com.facilitydesk.backend.modules.auth.domain.Capability.MANAGE_ATTENDANCE;
import static com.facilitydesk.backend.modules.auth.domain.Capability.MANAGE_DOCUMENTS;
import static com.facilitydesk.backend.modules.auth.domain.Capability.MANAGE_EMPLOYEES;
import static com.facilitydesk.backend.modules.auth.domain.Capability.MANAGE_FACILITIES;
import static com.facilitydesk.backend.modules.auth.domain.Capability.MANAGE_IOT;
import static com.facilitydesk.backend.modules.auth.domain.Capability.MANAGE_SERVICES;
import static com.facilitydesk.backend.modules.auth.domain.Capability.MANAGE_SHIFTS;
import static com.facilitydesk.backend.modules.auth.domain.Capability.VIEW_EMPLOYEE_REPORTS;
import static com.facilitydesk.backend.modules.auth.domain.Capability.VIEW_REPORTS;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.facilitydesk.backend.modules.auth.domain.Capability;
import com.facilitydesk.backend.modules.auth.domain.CapabilitySet;
import com.facilitydesk.backend.modules.auth.domain.FacilityUser;
import com.facilitydesk.backend.modules.auth.domain.UserRole;

import org.springframework.stereotype.Component;

/**
 * Maps roles to their default capability flags and layers per-user overrides on top.
 */
@Component
public class PermissionResolver {

    public CapabilitySet defaultsFor(UserRole role) {
        return switch (role) {
            case SUPER_ADMIN -> new CapabilitySet(EnumSet.allOf(Capability.class), List.of(CapabilitySet.ALL));
            case ADMIN -> new CapabilitySet(EnumSet.allOf(Capability.class), List.of());
            case FACILITY_MANAGER -> new CapabilitySet(EnumSet.of(
                    MANAGE_FACILITIES, MANAGE_SERVICES, MANAGE_IOT, VIEW_REPORTS,
                    MANAGE_EMPLOYEES, VIEW_EMPLOYEE_REPORTS, APPROVE_LEAVES,
                    MANAGE_ATTENDANCE, MANAGE_SHIFTS, MANAGE_DOCUMENTS), List.of());
            case SUPERVISOR -> new CapabilitySet(EnumSet.of(
                    MANAGE_SERVICES, MANAGE_IOT, VIEW_REPORTS,
                    VIEW_EMPLOYEE_REPORTS, MANAGE_ATTENDANCE, MANAGE_SHIFTS), List.of());
            case TECHNICIAN -> new CapabilitySet(EnumSet.of(MANAGE_IOT, VIEW_REPORTS), List.of());
            case HOUSEKEEPING, USER -> new CapabilitySet(EnumSet.of(VIEW_REPORTS), List.of());
            case GUEST -> CapabilitySet.none();
        };
    }

    /**
     * Explicit flags win over defaults key by key. Custom permissions from {@code customPermissions} replace
     * the defaults' list when non-null.
     */
    public CapabilitySet merge(CapabilitySet defaults, Map<Capability, Boolean> explicit, List<String> customPermissions) {
        Set<Capability> granted = defaults.granted().isEmpty()
                ? EnumSet.noneOf(Capability.class)
                : EnumSet.copyOf(defaults.granted());
        if (explicit != null) {
            explicit.forEach((capability, value) -> {
                if (Boolean.TRUE.equals(value)) {
                    granted.add(capability);
                } else {
                    granted.remove(capability);
                }
            });
        }
        List<String> custom = customPermissions != null ? customPermissions : defaults.customPermissions();
        return new CapabilitySet(granted, custom);
    }

    public CapabilitySet merge(CapabilitySet defaults, Map<Capability, Boolean> explicit) {
        return merge(defaults, explicit, null);
    }

    /**
     * Recomputes the identity's effective flags for its current role. Stored custom permissions are kept;
     * a fresh identity without any inherits the role default list.
     */
    public CapabilitySet resolve(FacilityUser user) {
        CapabilitySet defaults = defaultsFor(user.getRole());
        List<String> custom = user.getCustomPermissions().isEmpty() ? null : List.copyOf(user.getCustomPermissions());
        return merge(defaults, user.getPermissionOverrides(), custom);
    }

    public boolean hasCapability(FacilityUser user, String name) {
        return user.capabilities().has(name);
    }
}
