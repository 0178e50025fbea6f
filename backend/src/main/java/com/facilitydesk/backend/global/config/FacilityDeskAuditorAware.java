package com.facilitydesk.backend.global.config;

import java.util.Optional;
import java.util.UUID;

import com.facilitydesk.backend.global.security.AuthenticatedPrincipal;

import org.springframework.data.domain.AuditorAware;
import org.springframework.lang.NonNull;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;

/**
 * Resolves the acting identity id for JPA auditing.
 * Anonymous calls (login, password reset, bootstrap) resolve to {@code Optional.empty()}.
 */
@Component
public class FacilityDeskAuditorAware implements AuditorAware<UUID> {

    @Override
    @NonNull
    public Optional<UUID> getCurrentAuditor() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !authentication.isAuthenticated()) {
            return Optional.empty();
        }
        if (authentication.getPrincipal() instanceof AuthenticatedPrincipal principal) {
            return Optional.ofNullable(principal.userId());
        }
        return Optional.empty();
    }
}
