package com.facilitydesk.backend.global.security;

import java.util.Set;
import java.util.UUID;

import com.facilitydesk.backend.modules.auth.domain.CapabilitySet;
import com.facilitydesk.backend.modules.auth.domain.UserRole;

/**
 * Identity attached to an authenticated request, with its resolved capability set.
 */
public record AuthenticatedPrincipal(
        UUID userId,
        String email,
        UserRole role,
        CapabilitySet capabilities,
        Set<UUID> managedFacilities,
        String token
) {

    public AuthenticatedPrincipal {
        capabilities = capabilities != null ? capabilities : CapabilitySet.none();
        managedFacilities = managedFacilities != null ? Set.copyOf(managedFacilities) : Set.of();
    }

    public boolean hasCapability(String name) {
        return capabilities.has(name);
    }
}
