package com.facilitydesk.backend.modules.user.presentation.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * Partial profile update. Null fields are left unchanged.
 */
public record UpdateUserRequest(
        @Email @Size(max = 320) String email,
        @Size(min = 3, max = 50) @Pattern(regexp = "^[A-Za-z0-9_.-]+$", message = "username may contain letters, digits, '.', '_' and '-'") String username,
        @Size(min = 1, max = 100) String firstName,
        @Size(min = 1, max = 100) String lastName,
        @Size(max = 30) String phone,
        @Size(max = 100) String department,
        @Size(max = 100) String jobTitle
) {
}
