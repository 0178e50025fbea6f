package com.facilitydesk.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.UUID;

import com.facilitydesk.backend.modules.auth.domain.Capability;
import com.facilitydesk.backend.modules.auth.domain.FacilityUser;
import com.facilitydesk.backend.modules.auth.domain.UserRole;
import com.facilitydesk.backend.modules.auth.domain.VerificationTokenKind;
import com.facilitydesk.backend.modules.auth.infrastructure.persistence.FacilityUserRepository;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class CredentialStoreTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-03-01T09:00:00Z");

    @Mock
    private FacilityUserRepository facilityUserRepository;

    private CredentialStore credentialStore;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW.toInstant(), ZoneOffset.UTC);
        credentialStore = new CredentialStore(new BCryptPasswordEncoder(4), new PermissionResolver(), facilityUserRepository, clock);
    }

    @Test
    void hashAndVerify() {
        String hash = credentialStore.hash("correct horse");

        assertThat(hash).isNotEqualTo("correct horse").startsWith("$2");
        assertThat(credentialStore.verify("correct horse", hash)).isTrue();
        assertThat(credentialStore.verify("wrong horse", hash)).isFalse();
    }

    @Test
    @DisplayName("verify answers false instead of failing on missing or malformed input")
    void verifyToleratesBadInput() {
        assertThat(credentialStore.verify(null, "$2a$04$abc")).isFalse();
        assertThat(credentialStore.verify("secret", null)).isFalse();
        assertThat(credentialStore.verify("secret", "  ")).isFalse();
        assertThat(credentialStore.verify("secret", "not-a-bcrypt-hash")).isFalse();
    }

    @Test
    void hashRejectsEmptyPassword() {
        assertThatThrownBy(() -> credentialStore.hash(""))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("verification tokens are stored hashed and can be consumed once")
    void verificationTokenIsSingleUse() {
        FacilityUser user = new FacilityUser();

        String token = credentialStore.issueVerificationToken(user, VerificationTokenKind.PASSWORD_RESET);

        assertThat(token).hasSize(64);
        assertThat(user.getPasswordResetTokenHash()).isEqualTo(credentialStore.hashToken(token)).isNotEqualTo(token);
        assertThat(user.getPasswordResetExpiresAt()).isEqualTo(NOW.plusHours(1));

        assertThat(credentialStore.consumeVerificationToken(user, VerificationTokenKind.EMAIL_VERIFICATION, token)).isFalse();
        assertThat(credentialStore.consumeVerificationToken(user, VerificationTokenKind.PASSWORD_RESET, "nope")).isFalse();
        assertThat(credentialStore.consumeVerificationToken(user, VerificationTokenKind.PASSWORD_RESET, token)).isTrue();
        assertThat(user.getPasswordResetTokenHash()).isNull();
        assertThat(credentialStore.consumeVerificationToken(user, VerificationTokenKind.PASSWORD_RESET, token)).isFalse();
    }

    @Test
    void expiredTokenIsRejected() {
        FacilityUser user = new FacilityUser();
        String token = "a".repeat(64);
        user.setVerificationToken(VerificationTokenKind.EMAIL_VERIFICATION, credentialStore.hashToken(token), NOW);

        assertThat(credentialStore.consumeVerificationToken(user, VerificationTokenKind.EMAIL_VERIFICATION, token)).isFalse();
        assertThat(user.getEmailVerificationTokenHash()).isNotNull();
    }

    @Test
    @DisplayName("commit hashes a staged password and derives capabilities for a new identity")
    void commitPreparesNewIdentity() {
        when(facilityUserRepository.saveAndFlush(any(FacilityUser.class))).thenAnswer(invocation -> invocation.getArgument(0));
        FacilityUser user = new FacilityUser();
        user.setRole(UserRole.TECHNICIAN);
        user.changePassword("Str0ng-password");

        FacilityUser saved = credentialStore.commit(user);

        verify(facilityUserRepository).saveAndFlush(user);
        assertThat(saved.getPendingPassword()).isNull();
        assertThat(credentialStore.verify("Str0ng-password", saved.getPasswordHash())).isTrue();
        assertThat(saved.getSecurity().getLastPasswordChange()).isEqualTo(NOW);
        assertThat(saved.getGrantedCapabilities()).containsExactlyInAnyOrder(Capability.MANAGE_IOT, Capability.VIEW_REPORTS);
    }

    @Test
    @DisplayName("a role change on an existing identity recomputes its capabilities")
    void roleChangeRecomputesCapabilities() {
        FacilityUser user = new FacilityUser();
        user.setRole(UserRole.TECHNICIAN);
        ReflectionTestUtils.setField(user, "id", UUID.fromString("00000000-0000-0000-0000-000000000101"));
        credentialStore.prepareForPersist(user);
        assertThat(user.getGrantedCapabilities()).isEmpty();

        user.setRole(UserRole.FACILITY_MANAGER);
        credentialStore.prepareForPersist(user);

        assertThat(user.isRoleChanged()).isFalse();
        assertThat(user.getGrantedCapabilities()).contains(Capability.MANAGE_FACILITIES, Capability.MANAGE_EMPLOYEES);
    }
}
