package com.facilitydesk.backend.modules.user.presentation.dto;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.facilitydesk.backend.modules.auth.domain.EmploymentStatus;

public record EmployeeExitDetailsResponse(
        UUID employeeId,
        String employeeName,
        String email,
        LocalDate terminationDate,
        LocalDate lastWorkingDay,
        String exitReason,
        EmploymentStatus employmentStatus,
        boolean deleted,
        OffsetDateTime deletedAt,
        UUID deletedBy
) {
}
