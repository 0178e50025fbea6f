package com.facilitydesk.backend.modules.auth.application;

/**
 * Token could not be accepted. {@link Reason} tells expiry apart from tampering and other failures.
 */
public class TokenVerificationException extends RuntimeException {

    public enum Reason {
        EXPIRED,
        INVALID,
        VERIFICATION_FAILED
    }

    private final Reason reason;

    public TokenVerificationException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
