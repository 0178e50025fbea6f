package com.facilitydesk.backend.modules.auth.presentation.dto;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import com.facilitydesk.backend.modules.auth.domain.CapabilitySet;
import com.facilitydesk.backend.modules.auth.domain.EmployeeProfile;
import com.facilitydesk.backend.modules.auth.domain.EmploymentStatus;
import com.facilitydesk.backend.modules.auth.domain.FacilityUser;
import com.facilitydesk.backend.modules.auth.domain.UserRole;
import com.facilitydesk.backend.modules.auth.domain.UserStatus;
import com.facilitydesk.backend.modules.auth.domain.VerificationStatus;

public record UserProfileResponse(
        UUID id,
        String email,
        String username,
        String firstName,
        String lastName,
        String fullName,
        String phone,
        UserRole role,
        UserStatus status,
        VerificationStatus verificationStatus,
        Map<String, Boolean> permissions,
        List<String> customPermissions,
        Set<UUID> managedFacilities,
        Employment employment,
        boolean twoFactorEnabled,
        OffsetDateTime lastLoginAt,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public record Employment(
            String employeeId,
            String department,
            String jobTitle,
            EmploymentStatus employmentStatus,
            LocalDate hireDate,
            LocalDate probationEndDate,
            LocalDate confirmationDate,
            LocalDate terminationDate,
            LocalDate lastWorkingDay
    ) {
    }

    public static UserProfileResponse from(FacilityUser user) {
        CapabilitySet capabilities = user.capabilities();
        EmployeeProfile profile = user.getEmployeeProfile();
        return new UserProfileResponse(
                user.getId(),
                user.getEmail(),
                user.getUsername(),
                user.getFirstName(),
                user.getLastName(),
                user.getFullName(),
                user.getPhone(),
                user.getRole(),
                user.getStatus(),
                user.getVerificationStatus(),
                capabilities.asFlags(),
                capabilities.customPermissions(),
                Set.copyOf(user.getManagedFacilities()),
                new Employment(
                        profile.getEmployeeId(),
                        profile.getDepartment(),
                        profile.getJobTitle(),
                        profile.getEmploymentStatus(),
                        profile.getHireDate(),
                        profile.getProbationEndDate(),
                        profile.getConfirmationDate(),
                        profile.getTerminationDate(),
                        profile.getLastWorkingDay()
                ),
                user.getSecurity().isTwoFactorEnabled(),
                user.getSecurity().getLastLoginAt(),
                user.getCreatedAt(),
                user.getUpdatedAt()
        );
    }
}
