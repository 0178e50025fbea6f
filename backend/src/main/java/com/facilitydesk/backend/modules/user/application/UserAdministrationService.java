package com.facilitydesk.backend.modules.user.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

import com.facilitydesk.backend.global.error.ProblemException;
import com.facilitydesk.backend.global.security.AuthenticatedPrincipal;
import com.facilitydesk.backend.modules.audit.application.AuditLogService;
import com.facilitydesk.backend.modules.audit.domain.AuditAction;
import com.facilitydesk.backend.modules.auth.application.AccountNotificationSender;
import com.facilitydesk.backend.modules.auth.application.AuthorizationGate;
import com.facilitydesk.backend.modules.auth.application.CredentialStore;
import com.facilitydesk.backend.modules.auth.application.SessionRegistry;
import com.facilitydesk.backend.modules.auth.domain.Capability;
import com.facilitydesk.backend.modules.auth.domain.EmployeeProfile;
import com.facilitydesk.backend.modules.auth.domain.EmploymentStatus;
import com.facilitydesk.backend.modules.auth.domain.FacilityUser;
import com.facilitydesk.backend.modules.auth.domain.SessionRevocationReason;
import com.facilitydesk.backend.modules.auth.domain.UserRole;
import com.facilitydesk.backend.modules.auth.domain.UserStatus;
import com.facilitydesk.backend.modules.auth.domain.VerificationStatus;
import com.facilitydesk.backend.modules.auth.domain.VerificationTokenKind;
import com.facilitydesk.backend.modules.auth.infrastructure.persistence.FacilityUserRepository;
import com.facilitydesk.backend.modules.auth.presentation.dto.UserProfileResponse;
import com.facilitydesk.backend.modules.user.presentation.dto.AdminPasswordChangeRequest;
import com.facilitydesk.backend.modules.user.presentation.dto.CreateUserRequest;
import com.facilitydesk.backend.modules.user.presentation.dto.UpdateManagedFacilitiesRequest;
import com.facilitydesk.backend.modules.user.presentation.dto.UpdatePermissionsRequest;
import com.facilitydesk.backend.modules.user.presentation.dto.UpdateUserRequest;
import com.facilitydesk.backend.modules.user.presentation.dto.UserPageResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Identity administration. Every operation applies its role gate before touching data.
 */
@Service
@Transactional
public class UserAdministrationService {

    private static final Logger log = LoggerFactory.getLogger(UserAdministrationService.class);

    static final int DEFAULT_LIMIT = 10;
    static final int MAX_LIMIT = 100;

    private final FacilityUserRepository facilityUserRepository;
    private final CredentialStore credentialStore;
    private final SessionRegistry sessionRegistry;
    private final AuthorizationGate authorizationGate;
    private final AccountNotificationSender notificationSender;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public UserAdministrationService(
            FacilityUserRepository facilityUserRepository,
            CredentialStore credentialStore,
            SessionRegistry sessionRegistry,
            AuthorizationGate authorizationGate,
            AccountNotificationSender notificationSender,
            AuditLogService auditLogService,
            Clock clock
    ) {
        this.facilityUserRepository = facilityUserRepository;
        this.credentialStore = credentialStore;
        this.sessionRegistry = sessionRegistry;
        this.authorizationGate = authorizationGate;
        this.notificationSender = notificationSender;
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    public UserProfileResponse createUser(@NonNull AuthenticatedPrincipal actor, @NonNull CreateUserRequest request) {
        authorizationGate.requireManager(actor);
        if (request.role().isAdminTier()) {
            throw new ProblemException(HttpStatus.FORBIDDEN, "user.privileged_role",
                    "Cannot create SUPER_ADMIN or ADMIN users through this endpoint");
        }
        if (facilityUserRepository.existsByEmailIgnoreCase(request.email())) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "user.email_taken", "User with this email already exists");
        }
        if (request.username() != null && facilityUserRepository.existsByUsernameIgnoreCase(request.username())) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "user.username_taken", "Username already taken");
        }

        FacilityUser user = new FacilityUser();
        user.setEmail(request.email());
        user.setUsername(request.username());
        user.setFirstName(request.firstName().trim());
        user.setLastName(request.lastName().trim());
        user.setPhone(request.phone());
        user.setRole(request.role());
        user.setStatus(UserStatus.PENDING);
        user.setVerificationStatus(VerificationStatus.PENDING);
        user.changePassword(request.password());
        user.getManagedFacilities().addAll(actor.managedFacilities());

        EmployeeProfile profile = user.getEmployeeProfile();
        profile.setEmployeeId(request.employeeId());
        profile.setDepartment(request.department());
        profile.setJobTitle(request.jobTitle());
        profile.setHireDate(request.hireDate());
        profile.setProbationEndDate(request.probationEndDate());
        profile.setEmploymentStatus(request.probationEndDate() != null ? EmploymentStatus.PROBATION : EmploymentStatus.ACTIVE);

        String verificationToken = credentialStore.issueVerificationToken(user, VerificationTokenKind.EMAIL_VERIFICATION);
        FacilityUser saved = credentialStore.commit(user);
        notificationSender.sendEmailVerification(saved, verificationToken);

        auditLogService.recordUserEvent(AuditAction.USER_CREATED, saved.getId(), actor.userId(),
                Map.of("role", saved.getRole().name()));
        log.info("User {} created by {}", saved.getId(), actor.userId());
        return UserProfileResponse.from(saved);
    }

    @Transactional(readOnly = true)
    public UserPageResponse<UserProfileResponse> listUsers(
            @NonNull AuthenticatedPrincipal actor,
            UserRole role,
            UserStatus status,
            String search,
            Integer page,
            Integer limit
    ) {
        authorizationGate.requireManager(actor);
        int safePage = page == null || page < 1 ? 1 : page;
        int safeLimit = limit == null || limit < 1 ? DEFAULT_LIMIT : Math.min(limit, MAX_LIMIT);
        String pattern = search == null || search.isBlank()
                ? null
                : "%" + search.trim().toLowerCase(Locale.ROOT) + "%";

        Page<FacilityUser> result = facilityUserRepository.search(role, status, pattern,
                PageRequest.of(safePage - 1, safeLimit, Sort.by(Sort.Direction.DESC, "createdAt")));
        List<UserProfileResponse> items = result.getContent().stream()
                .map(UserProfileResponse::from)
                .toList();
        return new UserPageResponse<>(items, safePage, safeLimit, result.getTotalElements(), result.getTotalPages());
    }

    @Transactional(readOnly = true)
    public UserProfileResponse getUser(@NonNull AuthenticatedPrincipal actor, @NonNull UUID userId) {
        authorizationGate.requireOwnershipOrAdmin(actor, userId);
        return UserProfileResponse.from(findUser(userId));
    }

    public UserProfileResponse updateUser(@NonNull AuthenticatedPrincipal actor, @NonNull UUID userId, @NonNull UpdateUserRequest request) {
        authorizationGate.requireOwnershipOrAdmin(actor, userId);
        FacilityUser user = findUser(userId);

        if (request.email() != null && facilityUserRepository.existsByEmailIgnoreCaseAndIdNot(request.email(), userId)) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "user.email_taken", "User with this email already exists");
        }
        if (request.username() != null && facilityUserRepository.existsByUsernameIgnoreCaseAndIdNot(request.username(), userId)) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "user.username_taken", "Username already taken");
        }

        if (request.email() != null) {
            user.setEmail(request.email());
        }
        if (request.username() != null) {
            user.setUsername(request.username());
        }
        if (request.firstName() != null) {
            user.setFirstName(request.firstName().trim());
        }
        if (request.lastName() != null) {
            user.setLastName(request.lastName().trim());
        }
        if (request.phone() != null) {
            user.setPhone(request.phone());
        }
        if (request.department() != null) {
            user.getEmployeeProfile().setDepartment(request.department());
        }
        if (request.jobTitle() != null) {
            user.getEmployeeProfile().setJobTitle(request.jobTitle());
        }

        FacilityUser saved = credentialStore.commit(user);
        auditLogService.recordUserEvent(AuditAction.USER_UPDATED, userId, actor.userId(), Map.of());
        return UserProfileResponse.from(saved);
    }

    public void deleteUser(@NonNull AuthenticatedPrincipal actor, @NonNull UUID userId) {
        authorizationGate.requireSupervisor(actor);
        FacilityUser user = findUser(userId);
        if (user.getRole() == UserRole.SUPER_ADMIN) {
            throw new ProblemException(HttpStatus.FORBIDDEN, "user.super_admin_protected", "Cannot delete super admin user");
        }

        user.markDeleted(OffsetDateTime.now(clock), actor.userId());
        user.setStatus(UserStatus.INACTIVE);
        credentialStore.commit(user);
        int revoked = sessionRegistry.clear(userId, SessionRevocationReason.ACCOUNT_DELETED);

        auditLogService.recordUserEvent(AuditAction.USER_DELETED, userId, actor.userId(), Map.of("revokedSessions", revoked));
        log.info("User {} deleted by {}", userId, actor.userId());
    }

    public UserProfileResponse restoreUser(@NonNull AuthenticatedPrincipal actor, @NonNull UUID userId) {
        authorizationGate.requireSupervisor(actor);
        FacilityUser user = facilityUserRepository.findById(userId)
                .filter(FacilityUser::isDeleted)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "user.deleted_not_found", "Deleted user not found"));

        user.restore();
        user.setStatus(UserStatus.ACTIVE);
        FacilityUser saved = credentialStore.commit(user);

        auditLogService.recordUserEvent(AuditAction.USER_RESTORED, userId, actor.userId(), Map.of());
        log.info("User {} restored by {}", userId, actor.userId());
        return UserProfileResponse.from(saved);
    }

    public UserProfileResponse updateStatus(@NonNull AuthenticatedPrincipal actor, @NonNull UUID userId, @NonNull UserStatus status) {
        authorizationGate.requireSupervisor(actor);
        FacilityUser user = findUser(userId);
        protectSuperAdmin(actor, user);

        UserStatus previous = user.getStatus();
        user.setStatus(status);
        FacilityUser saved = credentialStore.commit(user);

        auditLogService.recordUserEvent(AuditAction.STATUS_CHANGED, userId, actor.userId(),
                Map.of("from", previous.name(), "to", status.name()));
        log.info("User {} status changed {} -> {} by {}", userId, previous, status, actor.userId());
        return UserProfileResponse.from(saved);
    }

    /**
     * Recomputes capabilities for the new role; explicit overrides and custom permissions carry over.
     */
    public UserProfileResponse updateRole(@NonNull AuthenticatedPrincipal actor, @NonNull UUID userId, @NonNull UserRole role) {
        authorizationGate.requireSupervisor(actor);
        if (role == UserRole.SUPER_ADMIN) {
            throw new ProblemException(HttpStatus.FORBIDDEN, "user.privileged_role", "SUPER_ADMIN cannot be granted through this endpoint");
        }
        if (role == UserRole.ADMIN) {
            authorizationGate.requireAdmin(actor);
        }
        FacilityUser user = findUser(userId);
        protectSuperAdmin(actor, user);

        UserRole previous = user.getRole();
        user.setRole(role);
        FacilityUser saved = credentialStore.commit(user);

        auditLogService.recordUserEvent(AuditAction.ROLE_CHANGED, userId, actor.userId(),
                Map.of("from", previous.name(), "to", role.name()));
        log.info("User {} role changed {} -> {} by {}", userId, previous, role, actor.userId());
        return UserProfileResponse.from(saved);
    }

    public UserProfileResponse updatePermissions(@NonNull AuthenticatedPrincipal actor, @NonNull UUID userId, @NonNull UpdatePermissionsRequest request) {
        authorizationGate.requireAdmin(actor);
        FacilityUser user = findUser(userId);
        protectSuperAdmin(actor, user);

        Map<String, Object> detail = new HashMap<>();
        if (request.permissions() != null) {
            request.permissions().forEach((key, value) -> {
                Capability capability = Capability.fromKey(key)
                        .orElseThrow(() -> new ProblemException(HttpStatus.BAD_REQUEST, "user.unknown_permission",
                                "Unknown permission: " + key));
                if (value == null) {
                    user.getPermissionOverrides().remove(capability);
                } else {
                    user.getPermissionOverrides().put(capability, value);
                }
            });
            detail.put("permissions", new HashMap<>(request.permissions()));
        }
        if (request.customPermissions() != null) {
            user.replaceCustomPermissions(request.customPermissions().stream()
                    .filter(permission -> permission != null && !permission.isBlank())
                    .map(String::trim)
                    .distinct()
                    .toList());
            detail.put("customPermissions", List.copyOf(user.getCustomPermissions()));
        }
        credentialStore.applyCapabilities(user);
        FacilityUser saved = credentialStore.commit(user);

        auditLogService.recordUserEvent(AuditAction.PERMISSIONS_CHANGED, userId, actor.userId(), detail);
        return UserProfileResponse.from(saved);
    }

    public UserProfileResponse updateManagedFacilities(@NonNull AuthenticatedPrincipal actor, @NonNull UUID userId, @NonNull UpdateManagedFacilitiesRequest request) {
        authorizationGate.requireAdmin(actor);
        FacilityUser user = findUser(userId);

        user.getManagedFacilities().clear();
        user.getManagedFacilities().addAll(request.facilityIds());
        FacilityUser saved = credentialStore.commit(user);

        auditLogService.recordUserEvent(AuditAction.MANAGED_FACILITIES_CHANGED, userId, actor.userId(),
                Map.of("facilities", request.facilityIds().stream().map(UUID::toString).sorted().toList()));
        return UserProfileResponse.from(saved);
    }

    public void changePassword(@NonNull AuthenticatedPrincipal actor, @NonNull UUID userId, @NonNull AdminPasswordChangeRequest request) {
        authorizationGate.requireSupervisor(actor);
        FacilityUser user = findUser(userId);
        protectSuperAdmin(actor, user);
        if (!credentialStore.verify(request.currentPassword(), user.getPasswordHash())) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "CURRENT_PASSWORD_INCORRECT", "Current password is incorrect");
        }
        user.changePassword(request.newPassword());
        credentialStore.commit(user);

        auditLogService.recordUserEvent(AuditAction.PASSWORD_CHANGED, userId, actor.userId(), Map.of());
        log.info("Password for user {} updated by {}", userId, actor.userId());
    }

    private FacilityUser findUser(UUID userId) {
        return facilityUserRepository.findActiveById(userId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "user.not_found", "User not found"));
    }

    private void protectSuperAdmin(AuthenticatedPrincipal actor, FacilityUser target) {
        if (target.getRole() == UserRole.SUPER_ADMIN && actor.role() != UserRole.SUPER_ADMIN) {
            throw new ProblemException(HttpStatus.FORBIDDEN, "user.super_admin_protected", "Super admin accounts can only be changed by a super admin");
        }
    }
}
