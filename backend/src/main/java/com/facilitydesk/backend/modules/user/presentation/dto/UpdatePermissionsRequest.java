package com.facilitydesk.backend.modules.user.presentation.dto;

import java.util.List;
import java.util.Map;

/**
 * Keys are capability names such as {@code canManageDocuments}. A null value drops the explicit override.
 * A null {@code customPermissions} leaves the list unchanged.
 */
public record UpdatePermissionsRequest(
        Map<String, Boolean> permissions,
        List<String> customPermissions
) {
}
