package com.facilitydesk.backend.modules.auth.domain;

public enum SessionRevocationReason {
    LOGOUT,
    LOGOUT_ALL,
    PASSWORD_CHANGED,
    PASSWORD_RESET,
    ACCOUNT_DELETED,
    ACCOUNT_TERMINATED
}
