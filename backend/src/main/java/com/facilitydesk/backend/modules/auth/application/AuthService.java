package com.facilitydesk.backend.modules.auth.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.facilitydesk.backend.global.error.ProblemException;
import com.facilitydesk.backend.global.security.AuthenticatedPrincipal;
import com.facilitydesk.backend.modules.audit.application.AuditLogService;
import com.facilitydesk.backend.modules.audit.domain.AuditAction;
import com.facilitydesk.backend.modules.auth.domain.FacilityUser;
import com.facilitydesk.backend.modules.auth.domain.LockoutState;
import com.facilitydesk.backend.modules.auth.domain.SessionRevocationReason;
import com.facilitydesk.backend.modules.auth.domain.UserStatus;
import com.facilitydesk.backend.modules.auth.domain.VerificationStatus;
import com.facilitydesk.backend.modules.auth.domain.VerificationTokenKind;
import com.facilitydesk.backend.modules.auth.infrastructure.persistence.FacilityUserRepository;
import com.facilitydesk.backend.modules.auth.presentation.dto.ChangePasswordRequest;
import com.facilitydesk.backend.modules.auth.presentation.dto.ForgotPasswordRequest;
import com.facilitydesk.backend.modules.auth.presentation.dto.LoginRequest;
import com.facilitydesk.backend.modules.auth.presentation.dto.LoginResponse;
import com.facilitydesk.backend.modules.auth.presentation.dto.MessageResponse;
import com.facilitydesk.backend.modules.auth.presentation.dto.RefreshRequest;
import com.facilitydesk.backend.modules.auth.presentation.dto.ResetPasswordRequest;
import com.facilitydesk.backend.modules.auth.presentation.dto.TokenPairResponse;
import com.facilitydesk.backend.modules.auth.presentation.dto.UserProfileResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

@Service
@Transactional(noRollbackFor = ResponseStatusException.class)
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    static final String FORGOT_PASSWORD_MESSAGE = "If an account exists for that email, a password reset link has been sent";

    private final FacilityUserRepository facilityUserRepository;
    private final CredentialStore credentialStore;
    private final AccountLockoutPolicy lockoutPolicy;
    private final SessionRegistry sessionRegistry;
    private final JwtTokenService jwtTokenService;
    private final AccountNotificationSender notificationSender;
    private final AuditLogService auditLogService;
    private final Clock clock;
    private final boolean exposeResetToken;

    public AuthService(
            FacilityUserRepository facilityUserRepository,
            CredentialStore credentialStore,
            AccountLockoutPolicy lockoutPolicy,
            SessionRegistry sessionRegistry,
            JwtTokenService jwtTokenService,
            AccountNotificationSender notificationSender,
            AuditLogService auditLogService,
            Clock clock,
            @Value("${facilitydesk.auth.expose-reset-token:false}") boolean exposeResetToken
    ) {
        this.facilityUserRepository = facilityUserRepository;
        this.credentialStore = credentialStore;
        this.lockoutPolicy = lockoutPolicy;
        this.sessionRegistry = sessionRegistry;
        this.jwtTokenService = jwtTokenService;
        this.notificationSender = notificationSender;
        this.auditLogService = auditLogService;
        this.clock = clock;
        this.exposeResetToken = exposeResetToken;
    }

    public LoginResponse login(LoginRequest request, String clientIp, String userAgent) {
        FacilityUser user = findLoginCandidate(request)
                .orElseThrow(AuthService::invalidCredentials);

        if (lockoutPolicy.isLocked(user)) {
            log.warn("Login rejected for locked user {}", user.getId());
            throw AuthFailureException.accountLocked(lockoutPolicy.remainingMinutes(user));
        }

        if (!credentialStore.verify(request.password(), user.getPasswordHash())) {
            LockoutState state = lockoutPolicy.recordFailure(user);
            credentialStore.commit(user);
            auditLogService.recordUserEvent(AuditAction.LOGIN_FAILED, user.getId(), null,
                    Map.of("failedAttempts", user.getSecurity().getFailedLoginAttempts()));
            if (state instanceof LockoutState.Locked locked) {
                log.warn("User {} locked until {} after {} failed logins",
                        user.getId(), locked.until(), user.getSecurity().getFailedLoginAttempts());
                auditLogService.recordUserEvent(AuditAction.ACCOUNT_LOCKED, user.getId(), null,
                        Map.of("lockoutUntil", locked.until().toString()));
            } else {
                log.warn("Failed login for user {} ({} consecutive)", user.getId(), user.getSecurity().getFailedLoginAttempts());
            }
            throw invalidCredentials();
        }

        if (user.getStatus() != UserStatus.ACTIVE) {
            throw new ProblemException(HttpStatus.FORBIDDEN, "ACCOUNT_NOT_ACTIVE",
                    "Account is " + user.getStatus().name().toLowerCase(Locale.ROOT) + ". Please contact administrator");
        }
        if (user.getVerificationStatus() != VerificationStatus.VERIFIED) {
            throw new ProblemException(HttpStatus.FORBIDDEN, "ACCOUNT_NOT_VERIFIED",
                    "Account is not verified. Please verify your email");
        }

        lockoutPolicy.recordSuccess(user);
        user.getSecurity().setLastLoginAt(OffsetDateTime.now(clock));
        user.getSecurity().setLastLoginIp(clientIp);
        credentialStore.commit(user);

        TokenPairResponse tokens = jwtTokenService.issueTokenPair(user, request.rememberMeRequested());
        String device = request.device() != null && !request.device().isBlank() ? request.device() : userAgent;
        sessionRegistry.add(user.getId(), tokens.accessToken(), new SessionMetadata(device, clientIp));

        auditLogService.recordUserEvent(AuditAction.LOGIN_SUCCEEDED, user.getId(), user.getId(),
                Map.of("ip", String.valueOf(clientIp)));
        log.info("User {} logged in", user.getId());
        return new LoginResponse(tokens, UserProfileResponse.from(user));
    }

    public LoginResponse refresh(RefreshRequest request, String clientIp, String userAgent) {
        JwtTokenService.ParsedToken parsed;
        try {
            parsed = jwtTokenService.parseRefreshToken(request.refreshToken());
        } catch (TokenVerificationException e) {
            String code = e.getReason() == TokenVerificationException.Reason.EXPIRED
                    ? "REFRESH_TOKEN_EXPIRED"
                    : "INVALID_REFRESH_TOKEN";
            throw new ProblemException(HttpStatus.UNAUTHORIZED, code, "Invalid refresh token. Please login again");
        }

        FacilityUser user = facilityUserRepository.findActiveById(parsed.userId())
                .orElseThrow(() -> new AuthFailureException(AuthFailure.IDENTITY_NOT_FOUND));
        if (user.getStatus() != UserStatus.ACTIVE) {
            throw AuthFailureException.accountNotActive(user.getStatus().name().toLowerCase(Locale.ROOT));
        }
        if (lockoutPolicy.isLocked(user)) {
            throw AuthFailureException.accountLocked(lockoutPolicy.remainingMinutes(user));
        }

        TokenPairResponse tokens = jwtTokenService.issueTokenPair(user, false);
        String device = request.device() != null && !request.device().isBlank() ? request.device() : userAgent;
        sessionRegistry.add(user.getId(), tokens.accessToken(), new SessionMetadata(device, clientIp));
        auditLogService.recordUserEvent(AuditAction.TOKEN_REFRESHED, user.getId(), user.getId(), Map.of());
        return new LoginResponse(tokens, UserProfileResponse.from(user));
    }

    public void logout(AuthenticatedPrincipal principal) {
        sessionRegistry.remove(principal.userId(), principal.token());
        auditLogService.recordUserEvent(AuditAction.LOGOUT, principal.userId(), principal.userId(), Map.of());
        log.info("User {} logged out", principal.userId());
    }

    public int logoutAll(AuthenticatedPrincipal principal) {
        int revoked = sessionRegistry.clear(principal.userId(), SessionRevocationReason.LOGOUT_ALL);
        auditLogService.recordUserEvent(AuditAction.LOGOUT_ALL, principal.userId(), principal.userId(),
                Map.of("revokedSessions", revoked));
        log.info("User {} logged out from {} session(s)", principal.userId(), revoked);
        return revoked;
    }

    @Transactional(readOnly = true)
    public UserProfileResponse loadProfile(UUID userId) {
        FacilityUser user = facilityUserRepository.findActiveById(userId)
                .orElseThrow(() -> new AuthFailureException(AuthFailure.IDENTITY_NOT_FOUND));
        return UserProfileResponse.from(user);
    }

    public void changePassword(AuthenticatedPrincipal principal, ChangePasswordRequest request) {
        FacilityUser user = facilityUserRepository.findActiveById(principal.userId())
                .orElseThrow(() -> new AuthFailureException(AuthFailure.IDENTITY_NOT_FOUND));
        if (!credentialStore.verify(request.currentPassword(), user.getPasswordHash())) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "CURRENT_PASSWORD_INCORRECT", "Current password is incorrect");
        }
        user.changePassword(request.newPassword());
        credentialStore.commit(user);

        if (Boolean.TRUE.equals(request.logoutAllDevices())) {
            sessionRegistry.clear(user.getId(), SessionRevocationReason.PASSWORD_CHANGED);
        }
        auditLogService.recordUserEvent(AuditAction.PASSWORD_CHANGED, user.getId(), principal.userId(),
                Map.of("logoutAllDevices", Boolean.TRUE.equals(request.logoutAllDevices())));
        log.info("User {} changed password", user.getId());
    }

    public void verifyEmail(String token) {
        FacilityUser user = facilityUserRepository.findByEmailVerificationTokenHash(credentialStore.hashToken(token))
                .filter(candidate -> credentialStore.consumeVerificationToken(candidate, VerificationTokenKind.EMAIL_VERIFICATION, token))
                .orElseThrow(() -> new ProblemException(HttpStatus.BAD_REQUEST, "INVALID_VERIFICATION_TOKEN",
                        "Invalid or expired verification token"));
        user.setVerificationStatus(VerificationStatus.VERIFIED);
        if (user.getStatus() == UserStatus.PENDING) {
            user.setStatus(UserStatus.ACTIVE);
        }
        credentialStore.commit(user);
        auditLogService.recordUserEvent(AuditAction.EMAIL_VERIFIED, user.getId(), user.getId(), Map.of());
        log.info("User {} verified email", user.getId());
    }

    /**
     * Responds identically whether or not the email belongs to an account.
     */
    public MessageResponse forgotPassword(ForgotPasswordRequest request) {
        Optional<FacilityUser> candidate = facilityUserRepository.findActiveByEmail(request.email().trim());
        if (candidate.isEmpty()) {
            log.info("Password reset requested for unknown email");
            return MessageResponse.of(FORGOT_PASSWORD_MESSAGE);
        }
        FacilityUser user = candidate.get();
        String token = credentialStore.issueVerificationToken(user, VerificationTokenKind.PASSWORD_RESET);
        credentialStore.commit(user);
        notificationSender.sendPasswordReset(user, token);
        auditLogService.recordUserEvent(AuditAction.PASSWORD_RESET_REQUESTED, user.getId(), null, Map.of());
        return new MessageResponse(FORGOT_PASSWORD_MESSAGE, exposeResetToken ? token : null);
    }

    public void resetPassword(String token, ResetPasswordRequest request) {
        FacilityUser user = facilityUserRepository.findByPasswordResetTokenHash(credentialStore.hashToken(token))
                .filter(candidate -> credentialStore.consumeVerificationToken(candidate, VerificationTokenKind.PASSWORD_RESET, token))
                .orElseThrow(() -> new ProblemException(HttpStatus.BAD_REQUEST, "INVALID_RESET_TOKEN",
                        "Invalid or expired reset token"));
        user.changePassword(request.password());
        lockoutPolicy.recordSuccess(user);
        credentialStore.commit(user);
        int revoked = sessionRegistry.clear(user.getId(), SessionRevocationReason.PASSWORD_RESET);
        auditLogService.recordUserEvent(AuditAction.PASSWORD_RESET, user.getId(), null,
                Map.of("revokedSessions", revoked));
        log.info("User {} reset password; {} session(s) revoked", user.getId(), revoked);
    }

    private Optional<FacilityUser> findLoginCandidate(LoginRequest request) {
        if (request.email() != null && !request.email().isBlank()) {
            return facilityUserRepository.findActiveByEmail(request.email().trim());
        }
        if (request.username() != null && !request.username().isBlank()) {
            return facilityUserRepository.findActiveByUsername(request.username().trim());
        }
        return Optional.empty();
    }

    private static ProblemException invalidCredentials() {
        return new ProblemException(HttpStatus.UNAUTHORIZED, "INVALID_CREDENTIALS", "Invalid credentials");
    }
}
