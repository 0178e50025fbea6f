package com.facilitydesk.backend.modules.user.presentation.dto;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.Set;
import java.util.UUID;

import com.facilitydesk.backend.modules.auth.domain.EmployeeProfile;
import com.facilitydesk.backend.modules.auth.domain.EmploymentStatus;
import com.facilitydesk.backend.modules.auth.domain.FacilityUser;
import com.facilitydesk.backend.modules.auth.domain.UserRole;
import com.facilitydesk.backend.modules.auth.domain.UserStatus;

/**
 * Employee listing row without security or permission data.
 */
public record EmployeeSummaryResponse(
        UUID id,
        String email,
        String firstName,
        String lastName,
        String fullName,
        String phone,
        UserRole role,
        UserStatus status,
        String employeeId,
        String department,
        String jobTitle,
        EmploymentStatus employmentStatus,
        LocalDate hireDate,
        Set<UUID> managedFacilities,
        OffsetDateTime createdAt
) {

    public static EmployeeSummaryResponse from(FacilityUser user) {
        EmployeeProfile profile = user.getEmployeeProfile();
        return new EmployeeSummaryResponse(
                user.getId(),
                user.getEmail(),
                user.getFirstName(),
                user.getLastName(),
                user.getFullName(),
                user.getPhone(),
                user.getRole(),
                user.getStatus(),
                profile.getEmployeeId(),
                profile.getDepartment(),
                profile.getJobTitle(),
                profile.getEmploymentStatus(),
                profile.getHireDate(),
                Set.copyOf(user.getManagedFacilities()),
                user.getCreatedAt()
        );
    }
}
