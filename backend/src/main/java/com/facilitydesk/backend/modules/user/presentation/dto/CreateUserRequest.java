package com.facilitydesk.backend.modules.user.presentation.dto;

import java.time.LocalDate;

import com.facilitydesk.backend.modules.auth.domain.UserRole;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record CreateUserRequest(
        @NotBlank @Email @Size(max = 320) String email,
        @Size(min = 3, max = 50) @Pattern(regexp = "^[A-Za-z0-9_.-]+$", message = "username may contain letters, digits, '.', '_' and '-'") String username,
        @NotBlank @Size(min = 8, max = 128) String password,
        @NotBlank @Size(max = 100) String firstName,
        @NotBlank @Size(max = 100) String lastName,
        @Size(max = 30) String phone,
        @NotNull UserRole role,
        @Size(max = 50) String employeeId,
        @Size(max = 100) String department,
        @Size(max = 100) String jobTitle,
        LocalDate hireDate,
        LocalDate probationEndDate
) {
}
