package com.facilitydesk.backend.modules.user.presentation.dto;

import com.facilitydesk.backend.modules.auth.domain.UserRole;

import jakarta.validation.constraints.NotNull;

public record UpdateUserRoleRequest(@NotNull UserRole role) {
}
