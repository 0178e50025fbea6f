package com.facilitydesk.backend.modules.auth.domain;

public enum EmploymentStatus {
    PROBATION,
    ACTIVE,
    ON_LEAVE,
    TERMINATED,
    RESIGNED,
    RETIRED
}
