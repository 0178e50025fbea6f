package com.facilitydesk.backend.modules.auth.domain;

import java.time.Duration;

/**
 * Single-use token purposes and their validity windows.
 */
public enum VerificationTokenKind {
    EMAIL_VERIFICATION(Duration.ofHours(24)),
    PASSWORD_RESET(Duration.ofHours(1));

    private final Duration validity;

    VerificationTokenKind(Duration validity) {
        this.validity = validity;
    }

    public Duration validity() {
        return validity;
    }
}
