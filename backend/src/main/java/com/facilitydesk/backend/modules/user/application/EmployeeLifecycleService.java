package com.facilitydesk.backend.modules.user.application;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import com.facilitydesk.backend.global.error.ProblemException;
import com.facilitydesk.backend.global.security.AuthenticatedPrincipal;
import com.facilitydesk.backend.modules.audit.application.AuditLogService;
import com.facilitydesk.backend.modules.audit.domain.AuditAction;
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
import com.facilitydesk.backend.modules.auth.infrastructure.persistence.FacilityUserRepository;
import com.facilitydesk.backend.modules.user.presentation.dto.EmployeeExitDetailsResponse;
import com.facilitydesk.backend.modules.user.presentation.dto.EmployeeSummaryResponse;
import com.facilitydesk.backend.modules.user.presentation.dto.TerminateEmployeeRequest;
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
 * Employment transitions for staff identities. Admin-tier identities are never employees.
 */
@Service
@Transactional
public class EmployeeLifecycleService {

    private static final Logger log = LoggerFactory.getLogger(EmployeeLifecycleService.class);

    private static final Set<UserRole> NON_EMPLOYEE_ROLES = EnumSet.of(UserRole.SUPER_ADMIN, UserRole.ADMIN);

    private final FacilityUserRepository facilityUserRepository;
    private final CredentialStore credentialStore;
    private final SessionRegistry sessionRegistry;
    private final AuthorizationGate authorizationGate;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public EmployeeLifecycleService(
            FacilityUserRepository facilityUserRepository,
            CredentialStore credentialStore,
            SessionRegistry sessionRegistry,
            AuthorizationGate authorizationGate,
            AuditLogService auditLogService,
            Clock clock
    ) {
        this.facilityUserRepository = facilityUserRepository;
        this.credentialStore = credentialStore;
        this.sessionRegistry = sessionRegistry;
        this.authorizationGate = authorizationGate;
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    /**
     * Ends employment on {@code exitDate}: the account is deactivated, soft-deleted and signed out everywhere.
     */
    public void terminate(@NonNull AuthenticatedPrincipal actor, @NonNull UUID employeeId, @NonNull TerminateEmployeeRequest request) {
        authorizationGate.requireSupervisor(actor);
        FacilityUser employee = findEmployee(employeeId);

        LocalDate today = LocalDate.now(clock);
        if (request.exitDate().isAfter(today)) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "employee.exit_date_in_future", "Exit date cannot be in the future");
        }

        EmployeeProfile profile = employee.getEmployeeProfile();
        profile.setEmploymentStatus(EmploymentStatus.TERMINATED);
        profile.setTerminationDate(request.exitDate());
        profile.setLastWorkingDay(request.exitDate());
        profile.setTerminationReason(request.reason().trim());
        employee.setStatus(UserStatus.INACTIVE);
        employee.markDeleted(OffsetDateTime.now(clock), actor.userId());
        credentialStore.commit(employee);

        int revoked = sessionRegistry.clear(employeeId, SessionRevocationReason.ACCOUNT_TERMINATED);
        auditLogService.recordUserEvent(AuditAction.EMPLOYEE_TERMINATED, employeeId, actor.userId(),
                Map.of("exitDate", request.exitDate().toString(), "revokedSessions", revoked));
        log.info("Employee {} terminated by {} effective {}", employeeId, actor.userId(), request.exitDate());
    }

    public EmployeeSummaryResponse confirm(@NonNull AuthenticatedPrincipal actor, @NonNull UUID employeeId) {
        authorizationGate.requireManager(actor);
        FacilityUser employee = findEmployee(employeeId);

        EmployeeProfile profile = employee.getEmployeeProfile();
        profile.setEmploymentStatus(EmploymentStatus.ACTIVE);
        profile.setConfirmationDate(LocalDate.now(clock));
        profile.setProbationEndDate(null);
        FacilityUser saved = credentialStore.commit(employee);

        auditLogService.recordUserEvent(AuditAction.EMPLOYEE_CONFIRMED, employeeId, actor.userId(), Map.of());
        return EmployeeSummaryResponse.from(saved);
    }

    @Transactional(readOnly = true)
    public UserPageResponse<EmployeeSummaryResponse> listByFacility(
            @NonNull AuthenticatedPrincipal actor,
            @NonNull UUID facilityId,
            UserRole role,
            UserStatus status,
            Integer page,
            Integer limit
    ) {
        authorizationGate.requireManager(actor);
        authorizationGate.requireFacilityAccess(actor, facilityId);

        int safePage = page == null || page < 1 ? 1 : page;
        int safeLimit = limit == null || limit < 1
                ? UserAdministrationService.DEFAULT_LIMIT
                : Math.min(limit, UserAdministrationService.MAX_LIMIT);
        UserRole roleFilter = role != null && NON_EMPLOYEE_ROLES.contains(role) ? null : role;

        Page<FacilityUser> result = facilityUserRepository.findEmployeesByFacility(
                facilityId, actor.userId(), NON_EMPLOYEE_ROLES, roleFilter, status,
                PageRequest.of(safePage - 1, safeLimit, Sort.by(Sort.Direction.DESC, "createdAt")));
        List<EmployeeSummaryResponse> items = result.getContent().stream()
                .map(EmployeeSummaryResponse::from)
                .toList();
        return new UserPageResponse<>(items, safePage, safeLimit, result.getTotalElements(), result.getTotalPages());
    }

    @Transactional(readOnly = true)
    public EmployeeExitDetailsResponse exitDetails(@NonNull AuthenticatedPrincipal actor, @NonNull UUID employeeId) {
        authorizationGate.requireManager(actor);
        authorizationGate.requireCapability(actor, Capability.VIEW_EMPLOYEE_REPORTS.key());
        FacilityUser employee = facilityUserRepository.findById(employeeId)
                .filter(candidate -> !NON_EMPLOYEE_ROLES.contains(candidate.getRole()))
                .orElseThrow(EmployeeLifecycleService::employeeNotFound);

        EmployeeProfile profile = employee.getEmployeeProfile();
        if (!employee.isDeleted() && profile.getTerminationDate() == null) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "employee.not_terminated", "Employee has not been terminated");
        }
        return new EmployeeExitDetailsResponse(
                employee.getId(),
                employee.getFullName(),
                employee.getEmail(),
                profile.getTerminationDate(),
                profile.getLastWorkingDay(),
                profile.getTerminationReason(),
                profile.getEmploymentStatus(),
                employee.isDeleted(),
                employee.getDeletedAt(),
                employee.getDeletedBy()
        );
    }

    private FacilityUser findEmployee(UUID employeeId) {
        return facilityUserRepository.findActiveById(employeeId)
                .filter(candidate -> !NON_EMPLOYEE_ROLES.contains(candidate.getRole()))
                .orElseThrow(EmployeeLifecycleService::employeeNotFound);
    }

    private static ProblemException employeeNotFound() {
        return new ProblemException(HttpStatus.NOT_FOUND, "employee.not_found", "Employee not found");
    }
}
