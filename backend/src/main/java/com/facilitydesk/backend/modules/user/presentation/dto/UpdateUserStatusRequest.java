package com.facilitydesk.backend.modules.user.presentation.dto;

import com.facilitydesk.backend.modules.auth.domain.UserStatus;

import jakarta.validation.constraints.NotNull;

public record UpdateUserStatusRequest(@NotNull UserStatus status) {
}
