package com.facilitydesk.backend.modules.auth.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * Named boolean capability flags. {@link #key()} is the name used on the wire and in custom permission checks.
 */
public enum Capability {
    MANAGE_USERS("canManageUsers"),
    MANAGE_FACILITIES("canManageFacilities"),
    MANAGE_SERVICES("canManageServices"),
    MANAGE_IOT("canManageIOT"),
    VIEW_REPORTS("canViewReports"),
    MANAGE_SETTINGS("canManageSettings"),
    MANAGE_BILLING("canManageBilling"),
    ACCESS_AUDIT_LOGS("canAccessAuditLogs"),
    MANAGE_EMPLOYEES("canManageEmployees"),
    VIEW_EMPLOYEE_REPORTS("canViewEmployeeReports"),
    APPROVE_LEAVES("canApproveLeaves"),
    MANAGE_ATTENDANCE("canManageAttendance"),
    MANAGE_SHIFTS("canManageShifts"),
    MANAGE_PAYROLL("canManagePayroll"),
    VIEW_SALARY_INFO("canViewSalaryInfo"),
    MANAGE_DOCUMENTS("canManageDocuments");

    private final String key;

    Capability(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static Optional<Capability> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(capability -> capability.key.equals(key) || capability.name().equals(key))
                .findFirst();
    }
}
