package com.facilitydesk.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;

import com.facilitydesk.backend.modules.auth.domain.Capability;
import com.facilitydesk.backend.modules.auth.domain.CapabilitySet;
import com.facilitydesk.backend.modules.auth.domain.FacilityUser;
import com.facilitydesk.backend.modules.auth.domain.UserRole;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PermissionResolverTest {

    private final PermissionResolver resolver = new PermissionResolver();

    @Test
    @DisplayName("super admin defaults grant every flag plus the wildcard custom permission")
    void superAdminDefaults() {
        CapabilitySet defaults = resolver.defaultsFor(UserRole.SUPER_ADMIN);

        assertThat(defaults.granted()).containsExactlyInAnyOrderElementsOf(EnumSet.allOf(Capability.class));
        assertThat(defaults.customPermissions()).containsExactly(CapabilitySet.ALL);
        assertThat(defaults.has("anything.at.all")).isTrue();
    }

    @Test
    @DisplayName("admin gets every flag but no wildcard")
    void adminDefaults() {
        CapabilitySet defaults = resolver.defaultsFor(UserRole.ADMIN);

        assertThat(defaults.granted()).hasSize(Capability.values().length);
        assertThat(defaults.customPermissions()).isEmpty();
        assertThat(defaults.has("reports.export")).isFalse();
    }

    @Test
    void technicianAndGuestDefaults() {
        assertThat(resolver.defaultsFor(UserRole.TECHNICIAN).granted())
                .containsExactlyInAnyOrder(Capability.MANAGE_IOT, Capability.VIEW_REPORTS);
        assertThat(resolver.defaultsFor(UserRole.GUEST).granted()).isEmpty();
        assertThat(resolver.defaultsFor(UserRole.USER).granted()).containsExactly(Capability.VIEW_REPORTS);
    }

    @Test
    @DisplayName("explicit flags win key by key over role defaults")
    void explicitFlagsOverrideDefaults() {
        Map<Capability, Boolean> explicit = new EnumMap<>(Capability.class);
        explicit.put(Capability.MANAGE_IOT, false);
        explicit.put(Capability.MANAGE_BILLING, true);

        CapabilitySet merged = resolver.merge(resolver.defaultsFor(UserRole.TECHNICIAN), explicit);

        assertThat(merged.granted()).containsExactlyInAnyOrder(Capability.VIEW_REPORTS, Capability.MANAGE_BILLING);
    }

    @Test
    void customPermissionsReplaceDefaultListWhenGiven() {
        CapabilitySet merged = resolver.merge(resolver.defaultsFor(UserRole.SUPER_ADMIN), Map.of(), List.of("reports.export"));

        assertThat(merged.customPermissions()).containsExactly("reports.export");
        assertThat(merged.has(Capability.MANAGE_PAYROLL)).isTrue();
    }

    @Test
    @DisplayName("resolve keeps stored custom permissions and overrides for the current role")
    void resolveUsesStoredState() {
        FacilityUser user = new FacilityUser();
        user.setRole(UserRole.SUPERVISOR);
        user.getPermissionOverrides().put(Capability.MANAGE_SHIFTS, false);
        user.replaceCustomPermissions(List.of("reports.export"));

        CapabilitySet resolved = resolver.resolve(user);

        assertThat(resolved.granted()).doesNotContain(Capability.MANAGE_SHIFTS).contains(Capability.MANAGE_IOT);
        assertThat(resolved.customPermissions()).containsExactly("reports.export");
    }

    @Test
    @DisplayName("moving to another role swaps the defaults underneath explicit flags")
    void roleChangeKeepsExplicitFlags() {
        FacilityUser user = new FacilityUser();
        user.setRole(UserRole.USER);
        user.getPermissionOverrides().put(Capability.MANAGE_DOCUMENTS, true);
        user.getPermissionOverrides().put(Capability.MANAGE_IOT, false);
        user.replaceCustomPermissions(List.of("reports.export"));
        assertThat(resolver.resolve(user).granted())
                .containsExactlyInAnyOrder(Capability.VIEW_REPORTS, Capability.MANAGE_DOCUMENTS);

        user.setRole(UserRole.FACILITY_MANAGER);
        CapabilitySet resolved = resolver.resolve(user);

        assertThat(resolved.granted())
                .contains(Capability.MANAGE_SERVICES, Capability.MANAGE_FACILITIES, Capability.MANAGE_DOCUMENTS)
                .doesNotContain(Capability.MANAGE_IOT, Capability.MANAGE_USERS);
        assertThat(resolved.customPermissions()).containsExactly("reports.export");
    }

    @Test
    void hasCapabilityAcceptsKeysNamesAndCustomEntries() {
        FacilityUser user = new FacilityUser();
        user.setRole(UserRole.TECHNICIAN);
        user.replaceGrantedCapabilities(EnumSet.of(Capability.MANAGE_IOT));
        user.replaceCustomPermissions(List.of("reports.export"));

        assertThat(resolver.hasCapability(user, "canManageIOT")).isTrue();
        assertThat(resolver.hasCapability(user, "MANAGE_IOT")).isTrue();
        assertThat(resolver.hasCapability(user, "reports.export")).isTrue();
        assertThat(resolver.hasCapability(user, "canManageBilling")).isFalse();
        assertThat(resolver.hasCapability(user, null)).isFalse();
    }
}
