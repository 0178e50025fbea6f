package com.facilitydesk.backend.modules.auth.application;

/**
 * Informational details recorded alongside a session entry.
 */
public record SessionMetadata(String device, String ipAddress) {

    public static SessionMetadata unknown() {
        return new SessionMetadata(null, null);
    }
}
