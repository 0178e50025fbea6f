package com.facilitydesk.backend.modules.auth.domain;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;

public enum UserRole {
    SUPER_ADMIN,
    ADMIN,
    FACILITY_MANAGER,
    SUPERVISOR,
    TECHNICIAN,
    HOUSEKEEPING,
    USER,
    GUEST;

    /**
     * Accepts both enum names and the hyphenated wire form ({@code facility-manager}).
     */
    @JsonCreator
    public static UserRole from(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("role must not be blank");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }

    public boolean isAdminTier() {
        return this == SUPER_ADMIN || this == ADMIN;
    }
}
