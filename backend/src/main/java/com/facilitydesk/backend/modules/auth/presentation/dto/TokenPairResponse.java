package com.facilitydesk.backend.modules.auth.presentation.dto;

import java.time.Duration;
import java.time.OffsetDateTime;

/**
 * Lifetimes are in seconds. The expiry instants match the tokens' {@code exp} claims.
 */
public record TokenPairResponse(
        String accessToken,
        String tokenType,
        long expiresIn,
        OffsetDateTime accessExpiresAt,
        String refreshToken,
        long refreshExpiresIn,
        OffsetDateTime refreshExpiresAt,
        boolean rememberMe
) {

    private static final String BEARER = "Bearer";

    public static TokenPairResponse bearer(
            String accessToken,
            Duration accessTtl,
            String refreshToken,
            Duration refreshTtl,
            OffsetDateTime issuedAt,
            boolean rememberMe
    ) {
        return new TokenPairResponse(
                accessToken,
                BEARER,
                accessTtl.toSeconds(),
                issuedAt.plus(accessTtl),
                refreshToken,
                refreshTtl.toSeconds(),
                issuedAt.plus(refreshTtl),
                rememberMe
        );
    }
}
