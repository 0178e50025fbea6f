package com.facilitydesk.backend.modules.user.presentation.dto;

import java.util.Set;
import java.util.UUID;

import jakarta.validation.constraints.NotNull;

public record UpdateManagedFacilitiesRequest(@NotNull Set<@NotNull UUID> facilityIds) {
}
