package com.facilitydesk.backend.modules.auth.infrastructure.jwt;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Signing keys for access and refresh tokens. Secrets may be Base64 or raw UTF-8.
 */
@Component
public class JwtTokenProvider {

    private static final String HMAC_SHA_256 = "HmacSHA256";

    private final SecretKey accessKey;
    private final SecretKey refreshKey;

    public JwtTokenProvider(
            @Value("${jwt.secret}") String accessSecret,
            @Value("${jwt.refresh-secret}") String refreshSecret
    ) {
        this.accessKey = toKey("jwt.secret", accessSecret);
        this.refreshKey = toKey("jwt.refresh-secret", refreshSecret);
    }

    public SecretKey getSecretKey() {
        return accessKey;
    }

    public SecretKey getRefreshKey() {
        return refreshKey;
    }

    private static SecretKey toKey(String property, String secretString) {
        if (secretString == null || secretString.isBlank()) {
            throw new IllegalStateException(property + " must be configured");
        }
        byte[] keyBytes;
        try {
            keyBytes = Base64.getDecoder().decode(secretString);
        } catch (IllegalArgumentException ex) {
            keyBytes = secretString.getBytes(StandardCharsets.UTF_8);
        }
        return new SecretKeySpec(keyBytes, HMAC_SHA_256);
    }
}
