package com.facilitydesk.backend.modules.user.presentation.dto;

import java.util.List;

public record UserPageResponse<T>(
        List<T> items,
        int page,
        int limit,
        long total,
        int pages
) {
}
