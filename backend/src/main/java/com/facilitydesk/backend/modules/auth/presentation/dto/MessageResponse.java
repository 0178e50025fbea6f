package com.facilitydesk.backend.modules.auth.presentation.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record MessageResponse(String message, String resetToken) {

    public static MessageResponse of(String message) {
        return new MessageResponse(message, null);
    }
}
