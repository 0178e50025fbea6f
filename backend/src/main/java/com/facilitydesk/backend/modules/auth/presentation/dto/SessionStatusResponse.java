package com.facilitydesk.backend.modules.auth.presentation.dto;

import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SessionStatusResponse(boolean authenticated, UUID userId, String email, String role) {

    public static SessionStatusResponse anonymous() {
        return new SessionStatusResponse(false, null, null, null);
    }
}
