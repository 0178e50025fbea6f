package com.facilitydesk.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ResetPasswordRequest(
        @NotBlank(message = "password is required")
        @Size(min = 8, max = 128, message = "password must be 8-128 characters") String password
) {
}
