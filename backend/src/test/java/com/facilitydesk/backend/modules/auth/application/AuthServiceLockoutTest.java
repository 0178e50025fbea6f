package com.facilitydesk.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import com.facilitydesk.backend.global.error.ProblemException;
import com.facilitydesk.backend.modules.audit.application.AuditLogService;
import com.facilitydesk.backend.modules.audit.domain.AuditAction;
import com.facilitydesk.backend.modules.auth.domain.FacilityUser;
import com.facilitydesk.backend.modules.auth.domain.UserRole;
import com.facilitydesk.backend.modules.auth.domain.UserStatus;
import com.facilitydesk.backend.modules.auth.domain.VerificationStatus;
import com.facilitydesk.backend.modules.auth.infrastructure.persistence.FacilityUserRepository;
import com.facilitydesk.backend.modules.auth.presentation.dto.LoginRequest;
import com.facilitydesk.backend.modules.auth.presentation.dto.LoginResponse;
import com.facilitydesk.backend.modules.auth.presentation.dto.TokenPairResponse;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class AuthServiceLockoutTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-03-01T09:00:00Z");
    private static final UUID USER_ID = UUID.fromString("00000000-0000-0000-0000-000000000501");
    private static final String EMAIL = "tech@example.com";
    private static final String PASSWORD = "Correct-horse1";

    @Mock
    private FacilityUserRepository facilityUserRepository;

    @Mock
    private SessionRegistry sessionRegistry;

    @Mock
    private JwtTokenService jwtTokenService;

    @Mock
    private AccountNotificationSender notificationSender;

    @Mock
    private AuditLogService auditLogService;

    private AuthService authService;
    private FacilityUser user;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW.toInstant(), ZoneOffset.UTC);
        CredentialStore credentialStore = new CredentialStore(
                new BCryptPasswordEncoder(4), new PermissionResolver(), facilityUserRepository, clock);
        authService = new AuthService(facilityUserRepository, credentialStore,
                new AccountLockoutPolicy(clock, 5, Duration.ofMinutes(30)), sessionRegistry, jwtTokenService,
                notificationSender, auditLogService, clock, false);

        user = new FacilityUser();
        user.setEmail(EMAIL);
        user.setRole(UserRole.TECHNICIAN);
        user.setStatus(UserStatus.ACTIVE);
        user.setVerificationStatus(VerificationStatus.VERIFIED);
        user.setPasswordHash(credentialStore.hash(PASSWORD));
        ReflectionTestUtils.setField(user, "id", USER_ID);

        when(facilityUserRepository.findActiveByEmail(EMAIL)).thenReturn(Optional.of(user));
    }

    @Test
    @DisplayName("five wrong passwords lock the account and the correct one is then refused with 423")
    void fifthFailureLocksAccount() {
        when(facilityUserRepository.saveAndFlush(any(FacilityUser.class))).thenAnswer(invocation -> invocation.getArgument(0));

        for (int i = 1; i <= 5; i++) {
            ProblemException failed = assertThrows(ProblemException.class, () -> login("Wrong-horse1"));
            assertThat(failed.getCode()).isEqualTo("INVALID_CREDENTIALS");
            assertThat(failed.getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
        }

        AuthFailureException locked = assertThrows(AuthFailureException.class, () -> login(PASSWORD));

        assertThat(locked.getFailure()).isEqualTo(AuthFailure.ACCOUNT_LOCKED);
        assertThat(locked.getStatusCode()).isEqualTo(HttpStatus.LOCKED);
        assertThat(locked.getDetailMessage()).contains("30 minutes");
        assertThat(user.getSecurity().getFailedLoginAttempts()).isEqualTo(5);
        assertThat(user.getSecurity().getLockoutUntil()).isEqualTo(NOW.plusMinutes(30));
        verify(auditLogService, times(5)).recordUserEvent(eq(AuditAction.LOGIN_FAILED), eq(USER_ID), isNull(), anyMap());
        verify(auditLogService).recordUserEvent(eq(AuditAction.ACCOUNT_LOCKED), eq(USER_ID), isNull(), anyMap());
        verify(sessionRegistry, never()).add(any(), any(), any());
    }

    @Test
    @DisplayName("after the lock elapses the correct password signs in and resets the counter")
    void elapsedLockAllowsLogin() {
        when(facilityUserRepository.saveAndFlush(any(FacilityUser.class))).thenAnswer(invocation -> invocation.getArgument(0));
        user.getSecurity().setFailedLoginAttempts(5);
        user.getSecurity().setLockoutUntil(NOW.minusMinutes(1));
        when(jwtTokenService.issueTokenPair(user, false)).thenReturn(TokenPairResponse.bearer(
                "access-token", Duration.ofMinutes(15), "refresh-token", Duration.ofDays(30), NOW, false));

        LoginResponse response = login(PASSWORD);

        assertThat(response.tokens().accessToken()).isEqualTo("access-token");
        assertThat(user.getSecurity().getFailedLoginAttempts()).isZero();
        assertThat(user.getSecurity().getLockoutUntil()).isNull();
        assertThat(user.getSecurity().getLastLoginIp()).isEqualTo("10.0.0.7");
        verify(sessionRegistry).add(eq(USER_ID), eq("access-token"), any(SessionMetadata.class));
        verify(auditLogService).recordUserEvent(eq(AuditAction.LOGIN_SUCCEEDED), eq(USER_ID), eq(USER_ID), anyMap());
    }

    @Test
    void lockedAccountIsRefusedBeforeThePasswordIsChecked() {
        user.getSecurity().setFailedLoginAttempts(5);
        user.getSecurity().setLockoutUntil(NOW.plusMinutes(10));

        AuthFailureException locked = assertThrows(AuthFailureException.class, () -> login("Wrong-horse1"));

        assertThat(locked.getFailure()).isEqualTo(AuthFailure.ACCOUNT_LOCKED);
        assertThat(user.getSecurity().getFailedLoginAttempts()).isEqualTo(5);
        verify(facilityUserRepository, never()).saveAndFlush(any(FacilityUser.class));
        verify(auditLogService, never()).recordUserEvent(any(), any(), any(), anyMap());
    }

    private LoginResponse login(String password) {
        return authService.login(new LoginRequest(EMAIL, null, password, null, null), "10.0.0.7", "JUnit");
    }
}
