package com.facilitydesk.backend.modules.user.application;

import java.util.Map;

import com.facilitydesk.backend.global.error.ProblemException;
import com.facilitydesk.backend.modules.audit.application.AuditLogService;
import com.facilitydesk.backend.modules.audit.domain.AuditAction;
import com.facilitydesk.backend.modules.auth.application.CredentialStore;
import com.facilitydesk.backend.modules.auth.domain.FacilityUser;
import com.facilitydesk.backend.modules.auth.domain.UserRole;
import com.facilitydesk.backend.modules.auth.domain.UserStatus;
import com.facilitydesk.backend.modules.auth.domain.VerificationStatus;
import com.facilitydesk.backend.modules.auth.infrastructure.persistence.FacilityUserRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Creates privileged identities outside the regular user API.
 */
@Service
@Transactional
public class IdentityProvisioningService {

    private static final Logger log = LoggerFactory.getLogger(IdentityProvisioningService.class);

    private final FacilityUserRepository facilityUserRepository;
    private final CredentialStore credentialStore;
    private final AuditLogService auditLogService;

    public IdentityProvisioningService(
            FacilityUserRepository facilityUserRepository,
            CredentialStore credentialStore,
            AuditLogService auditLogService
    ) {
        this.facilityUserRepository = facilityUserRepository;
        this.credentialStore = credentialStore;
        this.auditLogService = auditLogService;
    }

    @Transactional(readOnly = true)
    public boolean superAdminExists() {
        return facilityUserRepository.existsByRoleAndDeletedFalse(UserRole.SUPER_ADMIN);
    }

    /**
     * Only one super-admin may exist. The created account is active and verified.
     */
    public FacilityUser createSuperAdmin(SuperAdminCommand command) {
        if (superAdminExists()) {
            throw new ProblemException(HttpStatus.CONFLICT, "SUPER_ADMIN_EXISTS", "A super admin already exists");
        }
        if (facilityUserRepository.existsByEmailIgnoreCase(command.email())) {
            throw new ProblemException(HttpStatus.CONFLICT, "user.email_taken", "User with this email already exists");
        }

        FacilityUser user = new FacilityUser();
        user.setEmail(command.email());
        user.setUsername(command.username());
        user.setFirstName(command.firstName());
        user.setLastName(command.lastName());
        user.setRole(UserRole.SUPER_ADMIN);
        user.setStatus(UserStatus.ACTIVE);
        user.setVerificationStatus(VerificationStatus.VERIFIED);
        user.changePassword(command.password());

        FacilityUser saved = credentialStore.commit(user);
        auditLogService.recordUserEvent(AuditAction.SUPER_ADMIN_PROVISIONED, saved.getId(), null,
                Map.of("email", saved.getEmail()));
        log.info("Super admin {} provisioned", saved.getId());
        return saved;
    }

    public record SuperAdminCommand(String email, String username, String password, String firstName, String lastName) {
    }
}
