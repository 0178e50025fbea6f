package com.facilitydesk.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record LoginRequest(
        @Size(max = 320) String email,
        @Size(max = 50) String username,
        @NotBlank(message = "password is required") String password,
        Boolean rememberMe,
        @Size(max = 255) String device
) {

    @AssertTrue(message = "email or username is required")
    public boolean isIdentifierPresent() {
        return (email != null && !email.isBlank()) || (username != null && !username.isBlank());
    }

    public boolean rememberMeRequested() {
        return Boolean.TRUE.equals(rememberMe);
    }
}
