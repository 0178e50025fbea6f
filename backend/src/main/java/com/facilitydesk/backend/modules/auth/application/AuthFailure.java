package com.facilitydesk.backend.modules.auth.application;

import org.springframework.http.HttpStatus;

/**
 * Expected authentication and authorization outcomes with their fixed status codes.
 */
public enum AuthFailure {
    AUTHENTICATION_REQUIRED(HttpStatus.UNAUTHORIZED, "Authentication required. Please provide a valid token"),
    TOKEN_EXPIRED(HttpStatus.UNAUTHORIZED, "Token has expired. Please login again"),
    TOKEN_INVALID(HttpStatus.UNAUTHORIZED, "Invalid token. Please login again"),
    TOKEN_VERIFICATION_FAILED(HttpStatus.UNAUTHORIZED, "Token verification failed"),
    IDENTITY_NOT_FOUND(HttpStatus.UNAUTHORIZED, "User no longer exists. Please login again"),
    ACCOUNT_NOT_ACTIVE(HttpStatus.FORBIDDEN, "Account is not active. Please contact administrator"),
    ACCOUNT_LOCKED(HttpStatus.LOCKED, "Account is locked"),
    SESSION_INVALIDATED(HttpStatus.UNAUTHORIZED, "Session is no longer valid. Please login again"),
    INSUFFICIENT_PERMISSION(HttpStatus.FORBIDDEN, "Insufficient permissions to access this resource"),
    OWNERSHIP_VIOLATION(HttpStatus.FORBIDDEN, "Access denied. You can only access your own resources"),
    FACILITY_ACCESS_DENIED(HttpStatus.FORBIDDEN, "Access denied. You do not have permission to access this facility");

    private final HttpStatus status;
    private final String defaultMessage;

    AuthFailure(HttpStatus status, String defaultMessage) {
        this.status = status;
        this.defaultMessage = defaultMessage;
    }

    public HttpStatus status() {
        return status;
    }

    public String defaultMessage() {
        return defaultMessage;
    }
}
