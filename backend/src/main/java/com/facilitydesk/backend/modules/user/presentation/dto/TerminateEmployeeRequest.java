package com.facilitydesk.backend.modules.user.presentation.dto;

import java.time.LocalDate;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record TerminateEmployeeRequest(
        @NotNull(message = "exitDate is required") LocalDate exitDate,
        @NotBlank(message = "reason is required") @Size(max = 500) String reason
) {
}
