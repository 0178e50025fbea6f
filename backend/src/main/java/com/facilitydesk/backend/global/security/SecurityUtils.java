package com.facilitydesk.backend.global.security;

import java.util.Optional;
import java.util.UUID;

import com.facilitydesk.backend.modules.auth.application.AuthFailure;
import com.facilitydesk.backend.modules.auth.application.AuthFailureException;

import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

public final class SecurityUtils {

    private SecurityUtils() {
    }

    public static AuthenticatedPrincipal getCurrentPrincipal() {
        return findCurrentPrincipal()
                .orElseThrow(() -> new AuthFailureException(AuthFailure.AUTHENTICATION_REQUIRED));
    }

    public static Optional<AuthenticatedPrincipal> findCurrentPrincipal() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication != null && authentication.getPrincipal() instanceof AuthenticatedPrincipal principal) {
            return Optional.of(principal);
        }
        return Optional.empty();
    }

    public static UUID getCurrentUserId() {
        return getCurrentPrincipal().userId();
    }
}
