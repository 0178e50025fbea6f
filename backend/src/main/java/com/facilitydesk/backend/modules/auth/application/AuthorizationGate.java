package com.facilitydesk.backend.modules.auth.application;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import com.facilitydesk.backend.global.error.ProblemException;
import com.facilitydesk.backend.global.security.AuthenticatedPrincipal;
import com.facilitydesk.backend.modules.auth.domain.FacilityUser;
import com.facilitydesk.backend.modules.auth.domain.UserRole;
import com.facilitydesk.backend.modules.auth.domain.UserStatus;
import com.facilitydesk.backend.modules.auth.infrastructure.persistence.FacilityUserRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Request-time authentication and authorization decisions.
 *
 * <p>{@link #authenticate(String)} runs, in order: bearer extraction, token verification, identity lookup,
 * status check, lockout check and session membership, then builds the principal. Role, ownership and
 * facility-scope gates are applied separately by the endpoints that need them.</p>
 */
@Service
public class AuthorizationGate {

    private static final Logger log = LoggerFactory.getLogger(AuthorizationGate.class);

    public static final String BEARER_PREFIX = "Bearer ";

    private static final Set<UserRole> ADMIN_TIER = EnumSet.of(UserRole.SUPER_ADMIN, UserRole.ADMIN);
    private static final Set<UserRole> MANAGER_TIER = EnumSet.of(UserRole.SUPER_ADMIN, UserRole.ADMIN, UserRole.FACILITY_MANAGER);
    private static final Set<UserRole> SUPERVISOR_TIER = EnumSet.of(
            UserRole.SUPER_ADMIN, UserRole.ADMIN, UserRole.FACILITY_MANAGER, UserRole.SUPERVISOR);

    private final JwtTokenService jwtTokenService;
    private final FacilityUserRepository facilityUserRepository;
    private final AccountLockoutPolicy lockoutPolicy;
    private final SessionRegistry sessionRegistry;

    public AuthorizationGate(
            JwtTokenService jwtTokenService,
            FacilityUserRepository facilityUserRepository,
            AccountLockoutPolicy lockoutPolicy,
            SessionRegistry sessionRegistry
    ) {
        this.jwtTokenService = jwtTokenService;
        this.facilityUserRepository = facilityUserRepository;
        this.lockoutPolicy = lockoutPolicy;
        this.sessionRegistry = sessionRegistry;
    }

    @Transactional(readOnly = true)
    public AuthenticatedPrincipal authenticate(String authorizationHeader) {
        try {
            String token = extractToken(authorizationHeader)
                    .orElseThrow(() -> new AuthFailureException(AuthFailure.AUTHENTICATION_REQUIRED));
            JwtTokenService.ParsedToken parsed = verify(token);
            FacilityUser user = facilityUserRepository.findActiveById(parsed.userId())
                    .orElseThrow(() -> new AuthFailureException(AuthFailure.IDENTITY_NOT_FOUND));

            if (user.getStatus() != UserStatus.ACTIVE) {
                throw AuthFailureException.accountNotActive(user.getStatus().name().toLowerCase(Locale.ROOT));
            }
            if (lockoutPolicy.isLocked(user)) {
                throw AuthFailureException.accountLocked(lockoutPolicy.remainingMinutes(user));
            }
            if (!sessionRegistry.contains(user.getId(), token)) {
                throw new AuthFailureException(AuthFailure.SESSION_INVALIDATED);
            }
            return toPrincipal(user, token);
        } catch (ProblemException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Unexpected failure while authenticating request", e);
            throw new ProblemException(HttpStatus.INTERNAL_SERVER_ERROR, "authentication_failed", "Authentication failed");
        }
    }

    /**
     * Extraction, verification and identity lookup only. Any failure yields an anonymous caller.
     */
    @Transactional(readOnly = true)
    public Optional<AuthenticatedPrincipal> authenticateOptionally(String authorizationHeader) {
        try {
            Optional<String> token = extractToken(authorizationHeader);
            if (token.isEmpty()) {
                return Optional.empty();
            }
            JwtTokenService.ParsedToken parsed = jwtTokenService.parseAccessToken(token.get());
            return facilityUserRepository.findActiveById(parsed.userId())
                    .map(user -> toPrincipal(user, token.get()));
        } catch (RuntimeException e) {
            log.debug("Optional authentication ignored: {}", e.getMessage());
            return Optional.empty();
        }
    }

    public void authorize(AuthenticatedPrincipal principal, UserRole... allowedRoles) {
        authorize(principal, allowedRoles.length == 0 ? Set.of() : EnumSet.copyOf(Arrays.asList(allowedRoles)));
    }

    /**
     * Super-admin passes every role check, including one with an empty allow list.
     */
    public void authorize(AuthenticatedPrincipal principal, Set<UserRole> allowedRoles) {
        if (principal == null) {
            throw new AuthFailureException(AuthFailure.AUTHENTICATION_REQUIRED);
        }
        if (principal.role() == UserRole.SUPER_ADMIN) {
            return;
        }
        if (!allowedRoles.contains(principal.role())) {
            throw new AuthFailureException(AuthFailure.INSUFFICIENT_PERMISSION);
        }
    }

    public void requireSuperAdmin(AuthenticatedPrincipal principal) {
        authorize(principal, Set.of());
    }

    public void requireAdmin(AuthenticatedPrincipal principal) {
        authorize(principal, ADMIN_TIER);
    }

    public void requireManager(AuthenticatedPrincipal principal) {
        authorize(principal, MANAGER_TIER);
    }

    public void requireSupervisor(AuthenticatedPrincipal principal) {
        authorize(principal, SUPERVISOR_TIER);
    }

    public void requireCapability(AuthenticatedPrincipal principal, String capability) {
        if (principal == null) {
            throw new AuthFailureException(AuthFailure.AUTHENTICATION_REQUIRED);
        }
        if (!principal.hasCapability(capability)) {
            throw new AuthFailureException(AuthFailure.INSUFFICIENT_PERMISSION);
        }
    }

    /**
     * Admin tier and the identity itself pass. Facility managers and supervisors also pass without a
     * subordinate check.
     */
    public void requireOwnershipOrAdmin(AuthenticatedPrincipal principal, UUID targetUserId) {
        if (principal == null) {
            throw new AuthFailureException(AuthFailure.AUTHENTICATION_REQUIRED);
        }
        if (ADMIN_TIER.contains(principal.role()) || principal.userId().equals(targetUserId)) {
            return;
        }
        // TODO: check the reporting line once subordinate relationships are modelled
        if (principal.role() == UserRole.FACILITY_MANAGER || principal.role() == UserRole.SUPERVISOR) {
            return;
        }
        throw new AuthFailureException(AuthFailure.OWNERSHIP_VIOLATION);
    }

    public void requireFacilityAccess(AuthenticatedPrincipal principal, UUID facilityId) {
        if (principal == null) {
            throw new AuthFailureException(AuthFailure.AUTHENTICATION_REQUIRED);
        }
        if (ADMIN_TIER.contains(principal.role())) {
            return;
        }
        if (facilityId == null || !principal.managedFacilities().contains(facilityId)) {
            throw new AuthFailureException(AuthFailure.FACILITY_ACCESS_DENIED);
        }
    }

    private JwtTokenService.ParsedToken verify(String token) {
        try {
            return jwtTokenService.parseAccessToken(token);
        } catch (TokenVerificationException e) {
            AuthFailure failure = switch (e.getReason()) {
                case EXPIRED -> AuthFailure.TOKEN_EXPIRED;
                case INVALID -> AuthFailure.TOKEN_INVALID;
                case VERIFICATION_FAILED -> AuthFailure.TOKEN_VERIFICATION_FAILED;
            };
            throw new AuthFailureException(failure);
        }
    }

    private Optional<String> extractToken(String authorizationHeader) {
        if (authorizationHeader == null || !authorizationHeader.startsWith(BEARER_PREFIX)) {
            return Optional.empty();
        }
        String token = authorizationHeader.substring(BEARER_PREFIX.length()).trim();
        return token.isEmpty() ? Optional.empty() : Optional.of(token);
    }

    private AuthenticatedPrincipal toPrincipal(FacilityUser user, String token) {
        return new AuthenticatedPrincipal(
                user.getId(),
                user.getEmail(),
                user.getRole(),
                user.capabilities(),
                Set.copyOf(user.getManagedFacilities()),
                token
        );
    }
}
