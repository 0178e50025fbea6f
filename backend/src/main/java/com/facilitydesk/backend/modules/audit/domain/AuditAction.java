package com.facilitydesk.backend.modules.audit.domain;

public enum AuditAction {
    LOGIN_SUCCEEDED,
    LOGIN_FAILED,
    ACCOUNT_LOCKED,
    LOGOUT,
    LOGOUT_ALL,
    TOKEN_REFRESHED,
    PASSWORD_CHANGED,
    PASSWORD_RESET_REQUESTED,
    PASSWORD_RESET,
    EMAIL_VERIFIED,
    USER_CREATED,
    USER_UPDATED,
    ROLE_CHANGED,
    STATUS_CHANGED,
    PERMISSIONS_CHANGED,
    MANAGED_FACILITIES_CHANGED,
    USER_DELETED,
    USER_RESTORED,
    EMPLOYEE_TERMINATED,
    EMPLOYEE_CONFIRMED,
    SUPER_ADMIN_PROVISIONED
}
